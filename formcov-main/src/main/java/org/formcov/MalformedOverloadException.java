package org.formcov;

public class MalformedOverloadException extends FormWrapException {

    private final String overloadText;

    public MalformedOverloadException(String overloadText, String enclosingText, Integer line) {
        super("Malformed function overload " + overloadText + " in " + enclosingText, enclosingText, line);
        this.overloadText = overloadText;
    }

    public String getOverloadText() {
        return overloadText;
    }

    public String getEnclosingText() {
        return getFormText();
    }
}
