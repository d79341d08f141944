package io.formulaxform.core.error;

/**
 * Abstract base for all formula-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ExpressionLoadException} or {@link ExpressionEvalException}.
 */
public abstract class ExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final Phase phase;

    protected ExpressionException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ExpressionException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
