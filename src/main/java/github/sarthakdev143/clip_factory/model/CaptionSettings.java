package github.sarthakdev143.clip_factory.model;

import github.sarthakdev143.clip_factory.captions.CaptionStyle;

public record CaptionSettings(
        boolean includeCaptions,
        CaptionStyle style,
        String color,
        String outlineColor) {

    public CaptionSettings {
        style = style == null ? CaptionStyle.NONE : style;
        color = color == null || color.isBlank() ? null : color.trim();
        outlineColor = outlineColor == null || outlineColor.isBlank() ? null : outlineColor.trim();
    }

    public static CaptionSettings disabled() {
        return new CaptionSettings(false, CaptionStyle.NONE, null, null);
    }

    public boolean rendersCaptions() {
        return includeCaptions && style != CaptionStyle.NONE;
    }
}
