package labelbuilder.label.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic backend for layout tests: every code point is half the font size wide.
 * Canvases record the calls made on them.
 */
public class FixedWidthRenderBackend implements RenderBackend {

    private final List<RecordingCanvas> canvases = new ArrayList<>();
    private int measureCalls;

    @Override
    public float measureTextWidth(String text, FontSpec font, float size) {
        measureCalls++;
        return text.codePointCount(0, text.length()) * size * 0.5f;
    }

    @Override
    public LabelCanvas newCanvas(int width, int height) {
        RecordingCanvas canvas = new RecordingCanvas(width, height);
        canvases.add(canvas);
        return canvas;
    }

    public RecordingCanvas lastCanvas() {
        return canvases.get(canvases.size() - 1);
    }

    public int getMeasureCalls() {
        return measureCalls;
    }
}
