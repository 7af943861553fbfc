package labelbuilder.label.render;

import java.awt.Font;

public enum FontStyle {
    PLAIN(Font.PLAIN),
    BOLD(Font.BOLD),
    ITALIC(Font.ITALIC),
    BOLD_ITALIC(Font.BOLD | Font.ITALIC);

    private final int awtStyle;

    FontStyle(int awtStyle) {
        this.awtStyle = awtStyle;
    }

    public int getAwtStyle() {
        return awtStyle;
    }
}
