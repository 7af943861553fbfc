package labelbuilder.label.render;

import com.google.zxing.EncodeHintType;
import com.google.zxing.MultiFormatWriter;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import labelbuilder.config.LabelSettings;

import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;

public class ZxingBarcodeEncoder implements BarcodeEncoder {

    private final int margin;

    public ZxingBarcodeEncoder() {
        this(LabelSettings.getDefault().getBarcodeMargin());
    }

    public ZxingBarcodeEncoder(int margin) {
        this.margin = margin;
    }

    @Override
    public BufferedImage encode(String payload, BarcodeSymbology symbology, int width, int height) {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.CHARACTER_SET, "UTF-8");
        hints.put(EncodeHintType.MARGIN, margin);
        try {
            BitMatrix matrix = new MultiFormatWriter().encode(payload, symbology.getFormat(),
                    Math.max(1, width), Math.max(1, height), hints);
            return MatrixToImageWriter.toBufferedImage(matrix);
        } catch (WriterException | IllegalArgumentException e) {
            throw new BarcodeEncodingException(
                    String.format("Cannot encode '%s' as %s: %s", payload, symbology, e.getMessage()), e);
        }
    }
}
