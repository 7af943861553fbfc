package labelbuilder.label.render;

import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Java2DRenderBackendTest {

    private final Java2DRenderBackend backend = new Java2DRenderBackend();

    @Test
    void emptyTextHasNoWidth() {
        assertEquals(0f, backend.measureTextWidth("", FontSpec.of("SansSerif"), 20f));
    }

    @Test
    void canvasClearsAndDrawsImages() {
        BufferedImage red = solid(4, 4, Color.RED);
        BufferedImage result;
        try (LabelCanvas canvas = backend.newCanvas(20, 10)) {
            canvas.clear(Color.WHITE);
            canvas.drawImage(red, 10, 0, 10, 10);
            result = canvas.getImage();
        }

        assertEquals(20, result.getWidth());
        assertEquals(10, result.getHeight());
        assertEquals(Color.WHITE.getRGB(), result.getRGB(2, 5));
        assertEquals(Color.RED.getRGB(), result.getRGB(15, 5));
    }

    @Test
    void restoreUndoesRotation() {
        BufferedImage blue = solid(2, 2, Color.BLUE);
        BufferedImage result;
        try (LabelCanvas canvas = backend.newCanvas(20, 20)) {
            canvas.clear(Color.WHITE);
            canvas.save();
            canvas.rotate(180f, 10f, 10f);
            canvas.restore();
            canvas.drawImage(blue, 0, 0, 5, 5);
            result = canvas.getImage();
        }

        assertEquals(Color.BLUE.getRGB(), result.getRGB(2, 2));
        assertEquals(Color.WHITE.getRGB(), result.getRGB(17, 17));
    }

    @Test
    void restoreWithoutSaveFails() {
        try (LabelCanvas canvas = backend.newCanvas(5, 5)) {
            assertThrows(IllegalStateException.class, canvas::restore);
        }
    }

    static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, color.getRGB());
            }
        }
        return image;
    }
}
