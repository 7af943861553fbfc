package labelbuilder.label.model.element;

import labelbuilder.label.render.LabelCanvas;
import labelbuilder.label.render.TextMeasurer;

import java.util.Objects;

/**
 * Draws the wrapped element only when the draw-time context satisfies the condition.
 * Position is shared with the wrapped element, so moving the wrapper moves what is drawn.
 */
public class ConditionalElement<T> extends LabelElement {

    private final LabelElement element;
    private final ContextCondition<T> condition;

    public ConditionalElement(LabelElement element, ContextCondition<T> condition) {
        super(Objects.requireNonNull(element, "element").getX(), element.getY(), 0f);
        this.element = element;
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public void draw(LabelCanvas canvas, Object context) {
        if (condition.test(context)) {
            element.draw(canvas, context);
        }
    }

    @Override
    protected void paint(LabelCanvas canvas, Object context) {
        draw(canvas, context);
    }

    @Override
    public void scale(float factor) {
        element.scale(factor);
    }

    @Override
    protected void scaleSize(float factor) {
        element.scaleSize(factor);
    }

    @Override
    public float getMeasuredHeight() {
        return element.getMeasuredHeight();
    }

    @Override
    public float getMeasuredWidth(TextMeasurer measurer) {
        return element.getMeasuredWidth(measurer);
    }

    @Override
    public float getX() {
        return element.getX();
    }

    @Override
    public void setX(float x) {
        element.setX(x);
    }

    @Override
    public float getY() {
        return element.getY();
    }

    @Override
    public void setY(float y) {
        element.setY(y);
    }

    @Override
    public float getRotation() {
        return element.getRotation();
    }

    @Override
    public void setRotation(float rotation) {
        element.setRotation(rotation);
    }

    public LabelElement getElement() {
        return element;
    }

    public ContextCondition<T> getCondition() {
        return condition;
    }
}
