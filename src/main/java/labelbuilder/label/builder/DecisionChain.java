package labelbuilder.label.builder;

import labelbuilder.label.model.element.ContextCondition;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * One if / else-if / else sequence over the builder's context. At most one branch runs.
 * Each chain owns its fired flag, so a chain started inside a branch leaves the outer chain alone.
 */
public final class DecisionChain {

    private final LabelBuilder builder;
    private boolean fired;

    DecisionChain(LabelBuilder builder) {
        this.builder = builder;
    }

    DecisionChain evaluate(ContextCondition<?> condition, Consumer<LabelBuilder> configure) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(configure, "configure");
        if (!fired && condition.test(builder.getContext())) {
            fired = true;
            configure.accept(builder);
        }
        return this;
    }

    public <T> DecisionChain elseIf(Class<T> contextType, Predicate<? super T> condition, Consumer<LabelBuilder> configure) {
        return evaluate(ContextCondition.of(contextType, condition), configure);
    }

    public DecisionChain elseIf(ContextCondition<?> condition, Consumer<LabelBuilder> configure) {
        return evaluate(condition, configure);
    }

    public LabelBuilder orElse(Consumer<LabelBuilder> configure) {
        Objects.requireNonNull(configure, "configure");
        if (!fired) {
            fired = true;
            configure.accept(builder);
        }
        return builder;
    }

    public LabelBuilder end() {
        return builder;
    }

    public boolean hasFired() {
        return fired;
    }
}
