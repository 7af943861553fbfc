package labelbuilder.label.render;

@FunctionalInterface
public interface TextMeasurer {

    /**
     * Returns the advance width of {@code text} when rendered with {@code font} at {@code size}.
     */
    float measureTextWidth(String text, FontSpec font, float size);
}
