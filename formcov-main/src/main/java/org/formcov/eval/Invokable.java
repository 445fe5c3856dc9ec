package org.formcov.eval;

import java.util.List;

/**
 * A value that can stand in function position.
 */
@FunctionalInterface
public interface Invokable {

    Object invoke(List<Object> args);
}
