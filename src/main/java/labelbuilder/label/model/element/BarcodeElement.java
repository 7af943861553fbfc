package labelbuilder.label.model.element;

import labelbuilder.label.render.BarcodeEncoder;
import labelbuilder.label.render.BarcodeSymbology;
import labelbuilder.label.render.LabelCanvas;
import labelbuilder.label.render.TextMeasurer;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Barcode drawn into its target rectangle. The symbol is encoded on every draw so the
 * raster always matches the current (possibly scaled) rectangle.
 */
public class BarcodeElement extends LabelElement {

    private final String content;
    private final BarcodeSymbology symbology;
    private final BarcodeEncoder encoder;
    private float width;
    private float height;

    public BarcodeElement(String content, BarcodeSymbology symbology, BarcodeEncoder encoder,
                          float x, float y, float width, float height, float rotation) {
        super(x, y, rotation);
        this.content = content != null ? content : "";
        this.symbology = Objects.requireNonNull(symbology, "symbology");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.width = width;
        this.height = height;
    }

    @Override
    protected void paint(LabelCanvas canvas, Object context) {
        BufferedImage symbol = encoder.encode(content, symbology, Math.round(width), Math.round(height));
        canvas.drawImage(symbol, x, y, width, height);
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

    public String getContent() {
        return content;
    }

    public BarcodeSymbology getSymbology() {
        return symbology;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }
}
