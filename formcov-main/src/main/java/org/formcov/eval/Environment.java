package org.formcov.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lexical bindings of locals. Immutable: binding a name returns a child scope, so closures keep the scope they
 * were created in.
 */
public final class Environment {

    public static final Environment EMPTY = new Environment(null, Collections.emptyMap());

    private final Environment parent;
    private final Map<String, Object> bindings;

    private Environment(Environment parent, Map<String, Object> bindings) {
        this.parent = parent;
        this.bindings = bindings;
    }

    public Environment bind(String name, Object value) {
        return new Environment(this, Collections.singletonMap(name, value));
    }

    /**
     * Bind several names in one scope. Later entries shadow earlier ones with the same name.
     */
    public Environment bindAll(Map<String, Object> values) {
        if (values.isEmpty()) {
            return this;
        }
        return new Environment(this, new LinkedHashMap<>(values));
    }

    public boolean contains(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.bindings.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws EvaluatorException if the name is not bound
     */
    public Object lookup(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.bindings.containsKey(name)) {
                return env.bindings.get(name);
            }
        }
        throw new EvaluatorException("Unknown local: " + name);
    }
}
