package labelbuilder.label.render;

import java.awt.Font;
import java.util.Objects;

/**
 * Font reference held by text elements. The size lives on the element so that scaling
 * never has to rebuild the font reference.
 */
public record FontSpec(String family, FontStyle style) {

    public FontSpec {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(style, "style");
    }

    public static FontSpec of(String family) {
        return new FontSpec(family, FontStyle.PLAIN);
    }

    public static FontSpec bold(String family) {
        return new FontSpec(family, FontStyle.BOLD);
    }

    public Font toAwtFont(float size) {
        return new Font(family, style.getAwtStyle(), 1).deriveFont(size);
    }
}
