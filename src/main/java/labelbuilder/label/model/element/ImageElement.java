package labelbuilder.label.model.element;

import labelbuilder.label.render.LabelCanvas;
import labelbuilder.label.render.TextMeasurer;

import java.awt.image.BufferedImage;
import java.util.Objects;

public class ImageElement extends LabelElement {

    private final BufferedImage image;
    private float width;
    private float height;

    public ImageElement(BufferedImage image, float x, float y, float width, float height) {
        this(image, x, y, width, height, 0f);
    }

    public ImageElement(BufferedImage image, float x, float y, float width, float height, float rotation) {
        super(x, y, rotation);
        this.image = Objects.requireNonNull(image, "image");
        this.width = width;
        this.height = height;
    }

    @Override
    protected void paint(LabelCanvas canvas, Object context) {
        canvas.drawImage(image, x, y, width, height);
    }

    @Override
    protected void scaleSize(float factor) {
        width *= factor;
        height *= factor;
    }

    @Override
    public float getMeasuredHeight() {
        return height;
    }

    @Override
    public float getMeasuredWidth(TextMeasurer measurer) {
        return width;
    }

    public BufferedImage getImage() {
        return image;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }
}
