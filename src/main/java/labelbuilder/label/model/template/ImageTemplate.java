package labelbuilder.label.model.template;

public class ImageTemplate extends ElementTemplate {
    private float width;
    private float height;
    private String pngData; // base64

    public float getWidth() { return width; }
    public void setWidth(float width) { this.width = width; }
    public float getHeight() { return height; }
    public void setHeight(float height) { this.height = height; }
    public String getPngData() { return pngData; }
    public void setPngData(String pngData) { this.pngData = pngData; }
}
