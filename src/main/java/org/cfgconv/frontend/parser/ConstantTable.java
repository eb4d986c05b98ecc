package org.cfgconv.frontend.parser;

import org.cfgconv.model.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the constants defined with {@code name := value} during one parse session.
 * Values are stored fully resolved. Redefining a name overwrites the earlier binding;
 * substitutions made before the redefinition keep the value they received.
 */
public class ConstantTable {

    private final Map<String, Value> constants = new HashMap<>();

    /**
     * Binds a constant, replacing any earlier binding of the same name.
     * @param name The constant name.
     * @param value The resolved value.
     * @return The value previously bound to the name, if any.
     */
    public Optional<Value> define(String name, Value value) {
        return Optional.ofNullable(constants.put(name, value));
    }

    /**
     * Looks up a constant.
     * @param name The constant name.
     * @return The bound value, or empty if the name is not defined.
     */
    public Optional<Value> lookup(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(constants.keySet());
    }
}
