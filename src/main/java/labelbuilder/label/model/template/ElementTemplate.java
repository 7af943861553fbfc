package labelbuilder.label.model.template;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextTemplate.class, name = "text"),
        @JsonSubTypes.Type(value = BarcodeTemplate.class, name = "barcode"),
        @JsonSubTypes.Type(value = ImageTemplate.class, name = "image"),
        @JsonSubTypes.Type(value = ConditionalTemplate.class, name = "conditional")
})
public abstract class ElementTemplate {
    protected float x;
    protected float y;
    protected float rotation;

    public float getX() { return x; }
    public void setX(float x) { this.x = x; }
    public float getY() { return y; }
    public void setY(float y) { this.y = y; }
    public float getRotation() { return rotation; }
    public void setRotation(float rotation) { this.rotation = rotation; }
}
