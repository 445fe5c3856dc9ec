package org.formcov.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A named table of {@link Var}s.
 */
public class Namespace {

    private final String name;
    private final Map<String, Var> mappings = new LinkedHashMap<>();

    public Namespace(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * The var for {@code symbolName}, created unbound if missing.
     */
    public Var intern(String symbolName) {
        return mappings.computeIfAbsent(symbolName, n -> new Var(name, n));
    }

    public Optional<Var> find(String symbolName) {
        return Optional.ofNullable(mappings.get(symbolName));
    }

    public Map<String, Var> getMappings() {
        return Collections.unmodifiableMap(mappings);
    }

    @Override
    public String toString() {
        return "#namespace[" + name + "]";
    }
}
