package labelbuilder.label.render;

/**
 * Pixel backend used by the builder for measurement and by labels for rendering.
 */
public interface RenderBackend extends TextMeasurer {

    /**
     * Creates a canvas backed by a new {@code width x height} image. The caller closes it.
     */
    LabelCanvas newCanvas(int width, int height);
}
