package labelbuilder.label.render;

import java.awt.Color;
import java.awt.image.BufferedImage;

/**
 * Drawing surface handed to elements. {@link #save()} and {@link #restore()} bracket any
 * transformed draw.
 */
public interface LabelCanvas extends AutoCloseable {

    void clear(Color color);

    void save();

    void restore();

    void rotate(float degrees, float pivotX, float pivotY);

    /**
     * Draws {@code text} with its baseline at {@code baselineY}.
     */
    void drawText(String text, float x, float baselineY, FontSpec font, float size, Color color);

    void drawImage(BufferedImage image, float x, float y, float width, float height);

    BufferedImage getImage();

    @Override
    void close();
}
