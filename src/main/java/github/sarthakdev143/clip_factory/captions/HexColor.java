package github.sarthakdev143.clip_factory.captions;

import java.util.Locale;
import java.util.regex.Pattern;

public record HexColor(int red, int green, int blue) {

    private static final Pattern HEX_COLOR_PATTERN = Pattern.compile("^#[0-9a-fA-F]{6}$");

    public HexColor {
        if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
            throw new IllegalArgumentException("Color channels must be between 0 and 255.");
        }
    }

    public static HexColor parse(String value, String fieldName) {
        if (value == null || !HEX_COLOR_PATTERN.matcher(value.trim()).matches()) {
            throw new IllegalArgumentException(fieldName + " must be a hex color like #RRGGBB.");
        }
        String hex = value.trim().substring(1);
        return new HexColor(
                Integer.parseInt(hex.substring(0, 2), 16),
                Integer.parseInt(hex.substring(2, 4), 16),
                Integer.parseInt(hex.substring(4, 6), 16));
    }

    static HexColor of(String value) {
        return parse(value, "color");
    }

    /**
     * ASS colour literal ({@code &HAABBGGRR}); alpha 0 is opaque, 255 is fully transparent.
     */
    public String toAss(int alpha) {
        return String.format(Locale.ROOT, "&H%02X%02X%02X%02X", alpha, blue, green, red);
    }

    public String toAss() {
        return toAss(0);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }
}
