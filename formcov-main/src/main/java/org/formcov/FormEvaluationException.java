package org.formcov;

public class FormEvaluationException extends FormCoverageException {

    private final String rewrittenText;
    private final String originalText;

    public FormEvaluationException(String message, String rewrittenText, String originalText, Throwable cause) {
        super(message, cause);
        this.rewrittenText = rewrittenText;
        this.originalText = originalText;
    }

    public String getRewrittenText() {
        return rewrittenText;
    }

    public String getOriginalText() {
        return originalText;
    }
}
