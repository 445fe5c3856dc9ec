package org.formcov;

public class FormCoverageException extends RuntimeException {

    public FormCoverageException(String message) {
        super(message);
    }

    public FormCoverageException(String message, Throwable cause) {
        super(message, cause);
    }

    public FormCoverageException(Throwable cause) {
        super(cause);
    }
}
