package labelbuilder.label.model.element;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A predicate over a context value of a declared type. The instance check happens once in
 * {@link #test(Object)}; the predicate itself only ever sees values of {@code contextType}.
 *
 * @param name        registry key used when the condition is persisted, may be {@code null}
 * @param contextType type the context must have for the predicate to be consulted
 * @param predicate   the test applied to matching contexts
 */
public record ContextCondition<T>(String name, Class<T> contextType, Predicate<? super T> predicate) {

    public ContextCondition {
        Objects.requireNonNull(contextType, "contextType");
        Objects.requireNonNull(predicate, "predicate");
    }

    public static <T> ContextCondition<T> of(Class<T> contextType, Predicate<? super T> predicate) {
        return new ContextCondition<>(null, contextType, predicate);
    }

    public boolean test(Object context) {
        return contextType.isInstance(context) && predicate.test(contextType.cast(context));
    }

    public boolean isNamed() {
        return name != null && !name.isBlank();
    }
}
