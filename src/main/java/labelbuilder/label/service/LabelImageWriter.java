package labelbuilder.label.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Render sinks that write the finished label image to disk.
 */
public final class LabelImageWriter {

    private static final Logger logger = LoggerFactory.getLogger(LabelImageWriter.class);

    private LabelImageWriter() {
    }

    public static Consumer<BufferedImage> toFile(Path file) {
        return toFile(file, "png");
    }

    /**
     * Returns a sink writing the image in {@code format}. Write failures surface as
     * {@link UncheckedIOException} from the render call.
     */
    public static Consumer<BufferedImage> toFile(Path file, String format) {
        return image -> {
            try {
                write(image, file, format);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    public static void write(BufferedImage image, Path file, String format) throws IOException {
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("No image writer available for format: " + format);
        }
        logger.info("Wrote {}x{} label image to {}", image.getWidth(), image.getHeight(), file);
    }
}
