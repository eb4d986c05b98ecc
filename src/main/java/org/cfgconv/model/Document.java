package org.cfgconv.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of a parse: top-level names mapped to values in the order they were first bound.
 * Rebinding a name replaces its value but keeps its original position.
 */
public final class Document {

    /** The synthetic key under which a bare top-level value is stored. */
    public static final String BARE_VALUE_KEY = "_value";

    private final Map<String, Value> entries = new LinkedHashMap<>();

    /**
     * Binds a top-level name.
     * @param name The entry name.
     * @param value The fully resolved value.
     */
    public void put(String name, Value value) {
        entries.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
    }

    /**
     * Looks up a top-level entry.
     * @param name The entry name.
     * @return The bound value, if any.
     */
    public Optional<Value> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return An unmodifiable, insertion-ordered view of all entries.
     */
    public Map<String, Value> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Converts the document into plain Java objects, see {@link Value#unwrap()}.
     * @return An insertion-ordered map of entry names to unwrapped values.
     */
    public Map<String, Object> unwrap() {
        Map<String, Object> result = new LinkedHashMap<>();
        entries.forEach((name, value) -> result.put(name, value.unwrap()));
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + entries;
    }
}
