package labelbuilder.config;

import java.awt.Color;

/**
 * Reads and writes colors as {@code #RRGGBB} or {@code #AARRGGBB} hex strings.
 */
public final class Colors {

    private Colors() {
    }

    public static Color parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Color value must not be empty.");
        }
        String hex = value.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        try {
            return switch (hex.length()) {
                case 6 -> new Color(Integer.parseInt(hex, 16));
                case 8 -> new Color((int) Long.parseLong(hex, 16), true);
                default -> throw new IllegalArgumentException("Unsupported color format: " + value);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported color format: " + value, e);
        }
    }

    public static String format(Color color) {
        return String.format("#%08X", color.getRGB());
    }
}
