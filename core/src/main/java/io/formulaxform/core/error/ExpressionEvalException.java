package io.formulaxform.core.error;

/**
 * Abstract parent for evaluation errors. Thrown from {@code Expression.eval()} and {@code
 * Expression.simplify()}; the engine never retries or recovers. Carries the symbol involved in the
 * failure, where one is known.
 */
public abstract class ExpressionEvalException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    private final String symbol;

    protected ExpressionEvalException(String message, String symbol) {
        super(message, Phase.EVALUATION);
        this.symbol = symbol;
    }

    protected ExpressionEvalException(String message, Throwable cause, String symbol) {
        super(message, cause, Phase.EVALUATION);
        this.symbol = symbol;
    }

    /** The symbol that failed, or {@code null} if the failure is not tied to one. */
    public String symbol() {
        return symbol;
    }
}
