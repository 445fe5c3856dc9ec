package org.formcov.ast.meta;

import org.formcov.ast.Form;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable attribute map attached to a form out of band.
 * <p>
 * Values may be {@code null}; a key mapped to {@code null} is distinct from an absent key.
 */
public final class Metadata {

    public static final String LINE = "line";
    public static final String COLUMN = "column";
    public static final String SOURCE = "source";
    public static final String ORIGINAL = "original";

    public static final Metadata EMPTY = new Metadata(Map.of());

    private final Map<String, Object> attributes;

    private Metadata(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    public static Metadata of(String key, Object value) {
        return EMPTY.with(key, value);
    }

    public static Metadata ofLine(int line) {
        return of(LINE, line);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    public boolean containsKey(String key) {
        return attributes.containsKey(key);
    }

    /**
     * The recorded source line, or {@code null} when none is known.
     */
    public Integer line() {
        Object line = attributes.get(LINE);
        return line instanceof Integer number ? number : null;
    }

    public Optional<Form> original() {
        Object original = attributes.get(ORIGINAL);
        return original instanceof Form form ? Optional.of(form) : Optional.empty();
    }

    public Metadata with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    public Metadata without(String key) {
        if (!attributes.containsKey(key)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.remove(key);
        return copy.isEmpty() ? EMPTY : new Metadata(Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a copy of this metadata with every attribute of {@code other} layered on top.
     */
    public Metadata merge(Metadata other) {
        if (other.attributes.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.putAll(other.attributes);
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public Map<String, Object> asMap() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return attributes.equals(((Metadata) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "Metadata" + attributes;
    }
}
