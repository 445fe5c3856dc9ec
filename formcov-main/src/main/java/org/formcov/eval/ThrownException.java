package org.formcov.eval;

/**
 * Carries a checked exception thrown by evaluated code, or by a host method it called, so that it can travel
 * through the interpreter unchecked and still be caught by class in a {@code try} form.
 */
public class ThrownException extends EvaluatorException {

    private final Throwable thrown;

    public ThrownException(Throwable thrown) {
        super(thrown.getClass().getName() + ": " + thrown.getMessage(), thrown);
        this.thrown = thrown;
    }

    public Throwable getThrown() {
        return thrown;
    }

    /**
     * The exception as evaluated code sees it.
     */
    public static Throwable unwrap(Throwable t) {
        return t instanceof ThrownException wrapped ? wrapped.getThrown() : t;
    }

    /**
     * Rethrow unchecked exceptions as they are and wrap checked ones.
     */
    public static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException runtime) {
            return runtime;
        }
        if (t instanceof Error error) {
            throw error;
        }
        return new ThrownException(t);
    }
}
