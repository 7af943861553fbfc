package labelbuilder.label.model.element;

import labelbuilder.label.render.LabelCanvas;
import labelbuilder.label.render.TextMeasurer;

/**
 * A drawable unit on a label. Coordinates are in the owning label's units, with {@code (x, y)}
 * the top-left corner and the rotation pivot.
 */
public abstract class LabelElement {

    protected float x;
    protected float y;
    protected float rotation;

    protected LabelElement(float x, float y, float rotation) {
        this.x = x;
        this.y = y;
        this.rotation = rotation;
    }

    /**
     * Paints the element, rotating the canvas about {@code (x, y)} when a rotation is set.
     */
    public void draw(LabelCanvas canvas, Object context) {
        if (rotation == 0f) {
            paint(canvas, context);
            return;
        }
        canvas.save();
        try {
            canvas.rotate(rotation, getX(), getY());
            paint(canvas, context);
        } finally {
            canvas.restore();
        }
    }

    protected abstract void paint(LabelCanvas canvas, Object context);

    /**
     * Multiplies position, size and size-derived state by {@code factor}.
     * Cached measurements are dropped.
     */
    public void scale(float factor) {
        requirePositiveFactor(factor);
        x *= factor;
        y *= factor;
        scaleSize(factor);
    }

    protected abstract void scaleSize(float factor);

    public abstract float getMeasuredHeight();

    public abstract float getMeasuredWidth(TextMeasurer measurer);

    public float getX() {
        return x;
    }

    public void setX(float x) {
        this.x = x;
    }

    public float getY() {
        return y;
    }

    public void setY(float y) {
        this.y = y;
    }

    public float getRotation() {
        return rotation;
    }

    public void setRotation(float rotation) {
        this.rotation = rotation;
    }

    static void requirePositiveFactor(float factor) {
        if (!(factor > 0f)) {
            throw new IllegalArgumentException("Scale factor must be greater than 0, was " + factor);
        }
    }
}
