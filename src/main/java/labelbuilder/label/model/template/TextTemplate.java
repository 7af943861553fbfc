package labelbuilder.label.model.template;

import labelbuilder.label.render.FontStyle;

public class TextTemplate extends ElementTemplate {
    private String text = "";
    private String fontFamily = "SansSerif";
    private FontStyle fontStyle = FontStyle.PLAIN;
    private float fontSize = 30;
    private String color = "#FF000000";

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public FontStyle getFontStyle() {
        return fontStyle;
    }

    public void setFontStyle(FontStyle fontStyle) {
        this.fontStyle = fontStyle;
    }

    public float getFontSize() {
        return fontSize;
    }

    public void setFontSize(float fontSize) {
        this.fontSize = fontSize;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }
}
