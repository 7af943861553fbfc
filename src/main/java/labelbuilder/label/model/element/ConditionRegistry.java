package labelbuilder.label.model.element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Named conditions that persisted templates refer to. Conditional elements can only be
 * saved when their condition was registered here.
 */
public class ConditionRegistry {

    private final Map<String, ContextCondition<?>> conditions = new LinkedHashMap<>();

    public <T> ContextCondition<T> register(String name, Class<T> contextType, Predicate<? super T> predicate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Condition name must not be empty.");
        }
        ContextCondition<T> condition = new ContextCondition<>(name, contextType, predicate);
        conditions.put(name, condition);
        return condition;
    }

    public Optional<ContextCondition<?>> find(String name) {
        return Optional.ofNullable(conditions.get(name));
    }

    public Map<String, ContextCondition<?>> getConditions() {
        return Collections.unmodifiableMap(conditions);
    }
}
