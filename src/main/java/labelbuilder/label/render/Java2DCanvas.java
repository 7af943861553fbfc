package labelbuilder.label.render;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.Deque;

class Java2DCanvas implements LabelCanvas {

    private final BufferedImage image;
    private final Graphics2D g;
    private final Deque<AffineTransform> saved = new ArrayDeque<>();

    Java2DCanvas(BufferedImage image, Graphics2D g) {
        this.image = image;
        this.g = g;
    }

    @Override
    public void clear(Color color) {
        Color previous = g.getColor();
        g.setColor(color);
        g.fillRect(0, 0, image.getWidth(), image.getHeight());
        g.setColor(previous);
    }

    @Override
    public void save() {
        saved.push(g.getTransform());
    }

    @Override
    public void restore() {
        if (saved.isEmpty()) {
            throw new IllegalStateException("restore() called without a matching save()");
        }
        g.setTransform(saved.pop());
    }

    @Override
    public void rotate(float degrees, float pivotX, float pivotY) {
        g.rotate(Math.toRadians(degrees), pivotX, pivotY);
    }

    @Override
    public void drawText(String text, float x, float baselineY, FontSpec font, float size, Color color) {
        if (text.isEmpty()) {
            return;
        }
        g.setFont(font.toAwtFont(size));
        g.setColor(color);
        g.drawString(text, x, baselineY);
    }

    @Override
    public void drawImage(BufferedImage source, float x, float y, float width, float height) {
        g.drawImage(source, Math.round(x), Math.round(y), Math.round(width), Math.round(height), null);
    }

    @Override
    public BufferedImage getImage() {
        return image;
    }

    @Override
    public void close() {
        g.dispose();
    }
}
