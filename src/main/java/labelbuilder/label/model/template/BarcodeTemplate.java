package labelbuilder.label.model.template;

import labelbuilder.label.render.BarcodeSymbology;

public class BarcodeTemplate extends ElementTemplate {
    private String content = "";
    private BarcodeSymbology symbology = BarcodeSymbology.CODE_128;
    private float width = 200;
    private float height = 50;

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public BarcodeSymbology getSymbology() { return symbology; }
    public void setSymbology(BarcodeSymbology symbology) { this.symbology = symbology; }
    public float getWidth() { return width; }
    public void setWidth(float width) { this.width = width; }
    public float getHeight() { return height; }
    public void setHeight(float height) { this.height = height; }
}
