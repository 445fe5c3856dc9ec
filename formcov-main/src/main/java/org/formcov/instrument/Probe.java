package org.formcov.instrument;

import org.formcov.ast.Form;

/**
 * Builds the probe call that wraps one sub-form.
 * <p>
 * Evaluating the returned form must evaluate {@code form}, record that {@code line} was reached and return the
 * value of {@code form}.
 */
@FunctionalInterface
public interface Probe {

    /**
     * @param line the source line of the form, or {@code null} when unknown
     * @param form the form to wrap
     * @return a form wrapping {@code form} exactly once
     */
    Form wrap(Integer line, Form form);
}
