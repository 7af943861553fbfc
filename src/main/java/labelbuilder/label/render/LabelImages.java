package labelbuilder.label.render;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Image decoding for image elements. Unreadable input is reported as an {@link IOException},
 * never as a {@code null} image.
 */
public final class LabelImages {

    private LabelImages() {
    }

    public static BufferedImage read(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Unsupported or malformed image: " + file);
        }
        return image;
    }

    public static BufferedImage read(byte[] data) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        if (image == null) {
            throw new IOException("Unsupported or malformed image data (" + data.length + " bytes)");
        }
        return image;
    }
}
