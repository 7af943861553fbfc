package labelbuilder.label.model;

import labelbuilder.label.model.element.LabelElement;
import labelbuilder.label.render.LabelCanvas;
import labelbuilder.label.render.RenderBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A fixed-size canvas and the elements painted onto it, in insertion order.
 */
public class Label {

    private static final Logger logger = LoggerFactory.getLogger(Label.class);

    private final List<LabelElement> elements = new ArrayList<>();
    private final Color background;
    private float width;
    private float height;

    public Label(float width, float height) {
        this(width, height, Color.WHITE);
    }

    public Label(float width, float height, Color background) {
        if (!(width > 0f) || !(height > 0f)) {
            throw new IllegalArgumentException(
                    String.format("Label dimensions must be greater than 0, were %s x %s", width, height));
        }
        this.width = width;
        this.height = height;
        this.background = Objects.requireNonNull(background, "background");
    }

    public void addElement(LabelElement element) {
        elements.add(Objects.requireNonNull(element, "element"));
    }

    /**
     * Scales the canvas and every element by the same factor.
     */
    public void scale(float factor) {
        if (!(factor > 0f)) {
            throw new IllegalArgumentException("Scale factor must be greater than 0, was " + factor);
        }
        width *= factor;
        height *= factor;
        for (LabelElement element : elements) {
            element.scale(factor);
        }
    }

    /**
     * Paints every element onto a fresh canvas and passes the finished image to {@code sink}.
     * An element that fails to draw aborts the whole render.
     */
    public void render(RenderBackend backend, Consumer<BufferedImage> sink, Object context) {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(sink, "sink");
        int pixelWidth = Math.max(1, (int) width);
        int pixelHeight = Math.max(1, (int) height);
        logger.debug("Rendering {} elements onto a {}x{} canvas.", elements.size(), pixelWidth, pixelHeight);

        BufferedImage image;
        try (LabelCanvas canvas = backend.newCanvas(pixelWidth, pixelHeight)) {
            canvas.clear(background);
            for (LabelElement element : elements) {
                element.draw(canvas, context);
            }
            image = canvas.getImage();
        }
        sink.accept(image);
    }

    public List<LabelElement> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public Color getBackground() {
        return background;
    }
}
