package labelbuilder.label.render;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface BarcodeEncoder {

    /**
     * Encodes {@code payload} as a raster roughly {@code width x height} pixels.
     *
     * @throws BarcodeEncodingException if the payload cannot be represented in the symbology
     */
    BufferedImage encode(String payload, BarcodeSymbology symbology, int width, int height);
}
