package labelbuilder.label.builder;

import labelbuilder.label.model.element.ContextCondition;
import labelbuilder.label.render.FixedWidthRenderBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

import static labelbuilder.label.builder.LabelBuilderTest.BLANK_ENCODER;
import static labelbuilder.label.builder.LabelBuilderTest.FONT;
import static labelbuilder.label.model.HorizontalAlignment.LEFT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionChainTest {

    record Product(String name, boolean perishable, int stock) {
    }

    private final List<String> fired = new ArrayList<>();
    private LabelBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new LabelBuilder(200, 100, new FixedWidthRenderBackend(), BLANK_ENCODER);
    }

    @Test
    void firstMatchingBranchWins() {
        builder.withContext(new Product("milk", true, 3));

        chain();

        assertEquals(List.of("a"), fired);
    }

    @Test
    void elseIfRunsWhenIfDoesNotMatch() {
        builder.withContext(new Product("salt", false, 3));

        chain();

        assertEquals(List.of("b"), fired);
    }

    @Test
    void elseRunsWhenNothingMatches() {
        builder.withContext(new Product("salt", false, 0));

        chain();

        assertEquals(List.of("c"), fired);
    }

    @Test
    void contextOfAnotherTypeNeverMatches() {
        builder.withContext("not a product");

        chain();

        assertEquals(List.of("c"), fired);
    }

    @Test
    void withoutContextOnlyElseRuns() {
        chain();

        assertEquals(List.of("c"), fired);
    }

    @Test
    void branchesCanMatchOnDifferentTypes() {
        builder.withContext(42)
                .ifContext(Product.class, p -> true, b -> fired.add("product"))
                .elseIf(Integer.class, i -> i > 5, b -> fired.add("integer"))
                .orElse(b -> fired.add("else"));

        assertEquals(List.of("integer"), fired);
    }

    @Test
    void branchesAddElementsThroughTheBuilder() {
        builder.withContext(new Product("milk", true, 3))
                .ifContext(Product.class, Product::perishable,
                        b -> b.addText("KEEP COLD", 0, 10, FONT, 10, Color.BLUE, LEFT))
                .orElse(b -> b.addText("AMBIENT", 0, 10, FONT, 10, Color.BLACK, LEFT));

        assertEquals(1, builder.build().getElements().size());
    }

    @Test
    void nestedChainDoesNotResetOuterChain() {
        builder.withContext(new Product("milk", true, 0));

        builder.ifContext(Product.class, Product::perishable, b -> {
                    fired.add("outer-if");
                    b.ifContext(Product.class, p -> p.stock() > 0, inner -> fired.add("inner-if"))
                            .elseIf(Product.class, p -> p.stock() == 0, inner -> fired.add("inner-elseif"))
                            .end();
                })
                .elseIf(Product.class, p -> true, b -> fired.add("outer-elseif"))
                .orElse(b -> fired.add("outer-else"));

        assertEquals(List.of("outer-if", "inner-elseif"), fired);
    }

    @Test
    void consecutiveChainsAreIndependent() {
        builder.withContext(new Product("milk", true, 3));

        DecisionChain first = builder.ifContext(Product.class, Product::perishable, b -> fired.add("first"));
        DecisionChain second = builder.ifContext(Product.class, p -> p.stock() > 1, b -> fired.add("second"));
        second.orElse(b -> fired.add("second-else"));

        assertTrue(first.hasFired());
        assertEquals(List.of("first", "second"), fired);
    }

    @Test
    void namedConditionsWorkInChains() {
        ContextCondition<Product> lowStock = new ContextCondition<>("lowStock", Product.class, p -> p.stock() < 5);
        builder.withContext(new Product("milk", false, 2));

        DecisionChain chain = builder.ifContext(lowStock, b -> fired.add("low"));

        assertTrue(chain.hasFired());
        assertSame(builder, chain.end());
        assertEquals(List.of("low"), fired);
    }

    @Test
    void unmatchedChainReportsNotFired() {
        DecisionChain chain = builder.ifContext(Product.class, p -> true, b -> fired.add("x"));

        assertFalse(chain.hasFired());
    }

    @Test
    void rejectsMissingConditionOrCallback() {
        assertThrows(NullPointerException.class, () -> builder.ifContext(Product.class, null, b -> { }));
        assertThrows(NullPointerException.class, () -> builder.ifContext(null, b -> { }));
        assertThrows(NullPointerException.class,
                () -> builder.ifContext(Product.class, p -> true, null));
    }

    @Test
    void forRangeVisitsHalfOpenInterval() {
        List<Integer> visited = new ArrayList<>();

        LabelBuilder returned = builder.forRange(2, 5, (b, i) -> visited.add(i));

        assertSame(builder, returned);
        assertEquals(List.of(2, 3, 4), visited);
    }

    @Test
    void forRangeWithEmptyIntervalDoesNothing() {
        builder.forRange(3, 3, (b, i) -> fired.add("never"));
        builder.forRange(5, 1, (b, i) -> fired.add("never"));

        assertTrue(fired.isEmpty());
    }

    @Test
    void forEachAddsElementsInIterationOrder() {
        List<String> items = List.of("one", "two", "three");

        builder.forEach(items, (b, item) -> b.addText(item, 0, 10 + 12 * items.indexOf(item), FONT, 10, Color.BLACK, LEFT));

        assertEquals(3, builder.build().getElements().size());
        assertEquals(44f, builder.getLastY());
    }

    @Test
    void forEachRequiresItems() {
        assertThrows(NullPointerException.class, () -> builder.forEach(null, (b, item) -> { }));
    }

    private void chain() {
        builder.ifContext(Product.class, Product::perishable, b -> fired.add("a"))
                .elseIf(Product.class, p -> p.stock() > 0, b -> fired.add("b"))
                .orElse(b -> fired.add("c"));
    }
}
