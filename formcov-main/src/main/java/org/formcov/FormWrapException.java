package org.formcov;

public class FormWrapException extends FormCoverageException {

    private final String formText;
    private final Integer line;

    public FormWrapException(String message, String formText, Integer line) {
        super(message);
        this.formText = formText;
        this.line = line;
    }

    public FormWrapException(String message, String formText, Integer line, Throwable cause) {
        super(message, cause);
        this.formText = formText;
        this.line = line;
    }

    /**
     * The printed form that could not be wrapped.
     */
    public String getFormText() {
        return formText;
    }

    /**
     * The source line of the form, or {@code null} when unknown.
     */
    public Integer getLine() {
        return line;
    }
}
