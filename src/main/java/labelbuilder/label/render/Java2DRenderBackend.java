package labelbuilder.label.render;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * {@link RenderBackend} on top of {@link Graphics2D}. Works in headless mode.
 */
public class Java2DRenderBackend implements RenderBackend {

    @Override
    public float measureTextWidth(String text, FontSpec font, float size) {
        if (text == null || text.isEmpty()) {
            return 0f;
        }
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scratch.createGraphics();
        try {
            applyHints(g);
            return (float) g.getFontMetrics(font.toAwtFont(size)).getStringBounds(text, g).getWidth();
        } finally {
            g.dispose();
        }
    }

    @Override
    public LabelCanvas newCanvas(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        applyHints(g);
        return new Java2DCanvas(image, g);
    }

    static void applyHints(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
    }
}
