package github.sarthakdev143.clip_factory.captions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of caption presets with their default colours. Unknown names are rejected by {@link #fromInput}.
 */
public enum CaptionStyle {
    NONE(null, null, null, null, 0, 0.0, 0, TextCase.AS_IS, false, null),
    CLASSIC("#FFFFFF", "#000000", null, null, 0, 1.2, 3, TextCase.AS_IS, false, null),
    BOXED("#FFFFFF", null, null, "#000000", 75, 1.0, 0, TextCase.AS_IS, false, null),
    YELLOW("#FFFF00", "#000000", null, null, 0, 1.2, 3, TextCase.AS_IS, false, null),
    MINIMAL("#FFFFFF", null, null, null, 0, 0.9, 0, TextCase.LOWER, false, null),
    BOLD("#FFFFFF", "#000000", null, null, 0, 1.5, 5, TextCase.UPPER, false, null),
    KARAOKE("#FFFFFF", "#000000", "#FFFF00", null, 0, 1.2, 2, TextCase.AS_IS, false, null),
    NEON("#FF00FF", "#FF64FF", null, null, 0, 1.2, 4, TextCase.AS_IS, true, null),
    GRADIENT("#6464FF", "#000000", null, null, 0, 1.3, 2, TextCase.AS_IS, false, "#FF6464");

    public enum TextCase {
        AS_IS,
        UPPER,
        LOWER
    }

    private final HexColor primaryColor;
    private final HexColor outlineColor;
    private final HexColor highlightColor;
    private final HexColor backgroundColor;
    private final int backgroundAlpha;
    private final double fontScale;
    private final int outlineThickness;
    private final TextCase textCase;
    private final boolean glow;
    private final HexColor gradientEndColor;

    CaptionStyle(
            String primaryColor,
            String outlineColor,
            String highlightColor,
            String backgroundColor,
            int backgroundAlpha,
            double fontScale,
            int outlineThickness,
            TextCase textCase,
            boolean glow,
            String gradientEndColor) {
        this.primaryColor = primaryColor == null ? null : HexColor.of(primaryColor);
        this.outlineColor = outlineColor == null ? null : HexColor.of(outlineColor);
        this.highlightColor = highlightColor == null ? null : HexColor.of(highlightColor);
        this.backgroundColor = backgroundColor == null ? null : HexColor.of(backgroundColor);
        this.backgroundAlpha = backgroundAlpha;
        this.fontScale = fontScale;
        this.outlineThickness = outlineThickness;
        this.textCase = textCase;
        this.glow = glow;
        this.gradientEndColor = gradientEndColor == null ? null : HexColor.of(gradientEndColor);
    }

    public static CaptionStyle fromInput(String input) {
        if (input == null || input.isBlank()) {
            return NONE;
        }

        try {
            return CaptionStyle.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("caption_style must be one of " + allowedValues() + ".");
        }
    }

    public static String allowedValues() {
        return Arrays.stream(values())
                .map(CaptionStyle::toApiValue)
                .collect(Collectors.joining(", "));
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CaptionStyle fromApiValue(String value) {
        return fromInput(value);
    }

    public boolean hasOutline() {
        return outlineColor != null;
    }

    public boolean requiresWordTimings() {
        return this == KARAOKE;
    }

    public HexColor primaryColor() {
        return primaryColor;
    }

    public HexColor outlineColor() {
        return outlineColor;
    }

    public HexColor highlightColor() {
        return highlightColor;
    }

    public HexColor backgroundColor() {
        return backgroundColor;
    }

    public int backgroundAlpha() {
        return backgroundAlpha;
    }

    public double fontScale() {
        return fontScale;
    }

    public int outlineThickness() {
        return outlineThickness;
    }

    public TextCase textCase() {
        return textCase;
    }

    public boolean glow() {
        return glow;
    }

    public HexColor gradientEndColor() {
        return gradientEndColor;
    }
}
