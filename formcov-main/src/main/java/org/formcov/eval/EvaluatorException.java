package org.formcov.eval;

import org.formcov.FormCoverageException;

public class EvaluatorException extends FormCoverageException {

    public EvaluatorException(String message) {
        super(message);
    }

    public EvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
