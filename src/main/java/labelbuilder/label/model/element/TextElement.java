package labelbuilder.label.model.element;

import labelbuilder.label.render.FontSpec;
import labelbuilder.label.render.LabelCanvas;
import labelbuilder.label.render.TextMeasurer;

import java.awt.Color;
import java.util.Objects;

public class TextElement extends LabelElement {

    private final String text;
    private final FontSpec font;
    private final Color color;
    private float fontSize;
    private Float measuredWidth;

    public TextElement(String text, float x, float y, FontSpec font, float fontSize, Color color) {
        this(text, x, y, font, fontSize, color, 0f);
    }

    public TextElement(String text, float x, float y, FontSpec font, float fontSize, Color color, float rotation) {
        super(x, y, rotation);
        if (!(fontSize > 0f)) {
            throw new IllegalArgumentException("Font size must be greater than 0, was " + fontSize);
        }
        this.text = text != null ? text : "";
        this.font = Objects.requireNonNull(font, "font");
        this.color = Objects.requireNonNull(color, "color");
        this.fontSize = fontSize;
    }

    @Override
    protected void paint(LabelCanvas canvas, Object context) {
        // y is the top of the line
        canvas.drawText(text, x, y + fontSize, font, fontSize, color);
    }

    @Override
    protected void scaleSize(float factor) {
        fontSize *= factor;
        measuredWidth = null;
    }

    @Override
    public float getMeasuredHeight() {
        return fontSize;
    }

    @Override
    public float getMeasuredWidth(TextMeasurer measurer) {
        if (measuredWidth == null) {
            measuredWidth = measurer.measureTextWidth(text, font, fontSize);
        }
        return measuredWidth;
    }

    public String getText() {
        return text;
    }

    public FontSpec getFont() {
        return font;
    }

    public float getFontSize() {
        return fontSize;
    }

    public Color getColor() {
        return color;
    }
}
