package org.formcov.eval;

import org.formcov.ast.Form;

/**
 * Evaluates one top-level form in the context of everything evaluated before it.
 */
@FunctionalInterface
public interface FormEvaluator {

    Object eval(Form form);
}
