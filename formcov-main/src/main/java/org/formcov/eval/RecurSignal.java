package org.formcov.eval;

import java.util.List;

/**
 * The value of a {@code recur} form. The enclosing {@code loop*} or function rebinds its parameters from the
 * arguments and runs its body again.
 */
public record RecurSignal(List<Object> arguments) {

    @Override
    public String toString() {
        return "#<recur " + arguments + ">";
    }
}
