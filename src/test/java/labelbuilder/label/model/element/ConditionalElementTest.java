package labelbuilder.label.model.element;

import labelbuilder.label.render.FixedWidthRenderBackend;
import labelbuilder.label.render.FontSpec;
import labelbuilder.label.render.LabelCanvas;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionalElementTest {

    record Product(String name, boolean perishable) {
    }

    private final TextElement inner = new TextElement("KEEP COLD", 4, 6, FontSpec.of("SansSerif"), 10, Color.BLACK);
    private final ConditionalElement<Product> element =
            new ConditionalElement<>(inner, ContextCondition.of(Product.class, Product::perishable));

    @Test
    void drawsOnlyWhenContextMatchesTypeAndPredicate() {
        assertEquals(List.of("text 'KEEP COLD' @ 4.0,16.0"), drawWith(new Product("milk", true)));
        assertEquals(List.of(), drawWith(new Product("salt", false)));
        assertEquals(List.of(), drawWith("milk"));
        assertEquals(List.of(), drawWith(null));
    }

    @Test
    void sharesPositionWithWrappedElement() {
        assertEquals(4f, element.getX());
        assertEquals(6f, element.getY());

        element.setX(30);
        element.setY(12);

        assertEquals(30f, inner.getX());
        assertEquals(12f, inner.getY());
    }

    @Test
    void delegatesScaleAndMeasurement() {
        FixedWidthRenderBackend backend = new FixedWidthRenderBackend();

        element.scale(2f);

        assertEquals(20f, inner.getFontSize());
        assertEquals(8f, element.getX());
        assertEquals(20f, element.getMeasuredHeight());
        assertEquals(90f, element.getMeasuredWidth(backend));
    }

    @Test
    void nestedConditionStillGuardsWhenPaintedDirectly() {
        ConditionalElement<Product> outer = new ConditionalElement<>(
                new ConditionalElement<>(inner, ContextCondition.of(Product.class, p -> p.name().equals("cream"))),
                ContextCondition.of(Product.class, Product::perishable));
        FixedWidthRenderBackend backend = new FixedWidthRenderBackend();
        LabelCanvas canvas = backend.newCanvas(100, 100);

        outer.paint(canvas, new Product("milk", true));
        outer.draw(canvas, new Product("milk", true));

        assertEquals(List.of(), backend.lastCanvas().getCalls());
    }

    @Test
    void paintAppliesTheConditionAndRotation() {
        inner.setRotation(90f);
        FixedWidthRenderBackend backend = new FixedWidthRenderBackend();

        element.paint(backend.newCanvas(100, 100), new Product("salt", false));
        assertEquals(List.of(), backend.lastCanvas().getCalls());

        element.paint(backend.newCanvas(100, 100), new Product("milk", true));
        assertEquals(List.of("save", "rotate 90.0 @ 4.0,6.0", "text 'KEEP COLD' @ 4.0,16.0", "restore"),
                backend.lastCanvas().getCalls());
    }

    @Test
    void requiresElementAndCondition() {
        assertThrows(NullPointerException.class,
                () -> new ConditionalElement<>(null, ContextCondition.of(Product.class, p -> true)));
        assertThrows(NullPointerException.class, () -> new ConditionalElement<Product>(inner, null));
    }

    @Test
    void conditionChecksTypeBeforePredicate() {
        ContextCondition<Product> condition = ContextCondition.of(Product.class, p -> p.name().startsWith("m"));

        assertTrue(condition.test(new Product("milk", false)));
        assertFalse(condition.test(42));
        assertFalse(condition.isNamed());
    }

    private List<String> drawWith(Object context) {
        FixedWidthRenderBackend backend = new FixedWidthRenderBackend();
        element.draw(backend.newCanvas(100, 100), context);
        return backend.lastCanvas().getCalls();
    }
}
