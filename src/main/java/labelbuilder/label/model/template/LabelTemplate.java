package labelbuilder.label.model.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of a {@link labelbuilder.label.model.Label}: dimensions and elements in paint order.
 */
public class LabelTemplate {
    private String name = "New Template";
    private float width = 508;  // 2 inch at 203 dpi
    private float height = 203; // 1 inch at 203 dpi
    private String background = "#FFFFFFFF";
    private List<ElementTemplate> elements = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public float getWidth() {
        return width;
    }

    public void setWidth(float width) {
        this.width = width;
    }

    public float getHeight() {
        return height;
    }

    public void setHeight(float height) {
        this.height = height;
    }

    public String getBackground() {
        return background;
    }

    public void setBackground(String background) {
        this.background = background;
    }

    public List<ElementTemplate> getElements() {
        return elements;
    }

    public void setElements(List<ElementTemplate> elements) {
        this.elements = elements;
    }
}
