package labelbuilder.label.model.element;

import labelbuilder.label.render.FixedWidthRenderBackend;
import labelbuilder.label.render.FontSpec;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TextElementTest {

    private static final FontSpec FONT = FontSpec.of("SansSerif");

    @Test
    void nullTextBecomesEmpty() {
        TextElement element = new TextElement(null, 0, 0, FONT, 10, Color.BLACK);

        assertEquals("", element.getText());
    }

    @Test
    void heightIsFontSize() {
        assertEquals(18f, new TextElement("x", 0, 0, FONT, 18, Color.BLACK).getMeasuredHeight());
    }

    @Test
    void measuredWidthIsCachedUntilScaled() {
        FixedWidthRenderBackend backend = new FixedWidthRenderBackend();
        TextElement element = new TextElement("ABCD", 0, 0, FONT, 10, Color.BLACK);

        assertEquals(20f, element.getMeasuredWidth(backend));
        assertEquals(20f, element.getMeasuredWidth(backend));
        assertEquals(1, backend.getMeasureCalls());

        element.scale(2f);

        assertEquals(40f, element.getMeasuredWidth(backend));
        assertEquals(2, backend.getMeasureCalls());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TextElement("x", 0, 0, FONT, 0, Color.BLACK));
        assertThrows(NullPointerException.class, () -> new TextElement("x", 0, 0, null, 10, Color.BLACK));
        TextElement element = new TextElement("x", 0, 0, FONT, 10, Color.BLACK);
        assertThrows(IllegalArgumentException.class, () -> element.scale(0f));
    }

    @Test
    void rotatedTextIsBracketedBySaveAndRestore() {
        FixedWidthRenderBackend backend = new FixedWidthRenderBackend();
        TextElement element = new TextElement("R", 5, 10, FONT, 10, Color.BLACK, 90f);

        element.draw(backend.newCanvas(50, 50), null);

        assertEquals(List.of("save", "rotate 90.0 @ 5.0,10.0", "text 'R' @ 5.0,20.0", "restore"),
                backend.lastCanvas().getCalls());
    }
}
