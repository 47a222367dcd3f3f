package github.sarthakdev143.clip_factory.captions;

import github.sarthakdev143.clip_factory.model.CaptionSettings;
import org.springframework.stereotype.Component;

/**
 * Rejects caption options at submission time so no job is created with a style it cannot render.
 */
@Component
public class CaptionSettingsValidator {

    public CaptionSettings normalizeAndValidate(
            Boolean includeCaptionsInput,
            String styleInput,
            String colorInput,
            String outlineColorInput) {
        boolean includeCaptions = includeCaptionsInput == null || includeCaptionsInput;
        CaptionStyle style = CaptionStyle.fromInput(styleInput);
        String color = blankToNull(colorInput);
        String outlineColor = blankToNull(outlineColorInput);

        if (color != null) {
            HexColor.parse(color, "caption_color");
        }
        if (outlineColor != null) {
            HexColor.parse(outlineColor, "caption_outline_color");
        }

        if (style == CaptionStyle.NONE && (color != null || outlineColor != null)) {
            throw new IllegalArgumentException("Caption colors require a caption_style other than none.");
        }
        if (outlineColor != null && !style.hasOutline()) {
            throw new IllegalArgumentException(
                    "caption_style " + style.toApiValue() + " has no outline; caption_outline_color is not allowed.");
        }

        return new CaptionSettings(includeCaptions, style, color, outlineColor);
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
