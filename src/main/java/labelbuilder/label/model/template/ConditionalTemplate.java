package labelbuilder.label.model.template;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A wrapped element plus the registry name of the condition that guards it. Position is
 * stored on the wrapped element only.
 */
public class ConditionalTemplate extends ElementTemplate {
    private String condition;
    private ElementTemplate element;

    public String getCondition() { return condition; }
    public void setCondition(String condition) { this.condition = condition; }
    public ElementTemplate getElement() { return element; }
    public void setElement(ElementTemplate element) { this.element = element; }

    @Override
    @JsonIgnore
    public float getX() { return element != null ? element.getX() : x; }

    @Override
    @JsonIgnore
    public float getY() { return element != null ? element.getY() : y; }

    @Override
    @JsonIgnore
    public float getRotation() { return element != null ? element.getRotation() : rotation; }
}
