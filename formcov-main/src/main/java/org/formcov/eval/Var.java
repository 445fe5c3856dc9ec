package org.formcov.eval;

import java.util.List;

/**
 * A named, mutable root binding in a {@link Namespace}.
 */
public class Var implements Invokable {

    private static final Object UNBOUND = new Object();

    private final String namespace;
    private final String name;
    private Object root = UNBOUND;

    public Var(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public boolean isBound() {
        return root != UNBOUND;
    }

    public void bindRoot(Object value) {
        this.root = value;
    }

    /**
     * @throws EvaluatorException if the var was declared but never given a value
     */
    public Object deref() {
        if (root == UNBOUND) {
            throw new EvaluatorException("Attempting to call unbound var " + this);
        }
        return root;
    }

    @Override
    public Object invoke(List<Object> args) {
        return Values.invoke(deref(), args);
    }

    @Override
    public String toString() {
        return "#'" + namespace + "/" + name;
    }
}
