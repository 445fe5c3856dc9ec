package org.formcov;

public class FormReadException extends FormCoverageException {

    private final String source;
    private final int line;
    private final int column;

    public FormReadException(String message, String source, int line, int column) {
        super(message + " (" + source + ":" + line + ":" + column + ")");
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public FormReadException(String message, String source, int line, int column, Throwable cause) {
        super(message + " (" + source + ":" + line + ":" + column + ")", cause);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
