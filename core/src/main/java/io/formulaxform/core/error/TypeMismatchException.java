package io.formulaxform.core.error;

/**
 * Thrown when an operator or function rejects its actual operands, e.g. adding a string to a
 * number or calling a value that is not callable. The original failure is kept as the cause.
 */
public final class TypeMismatchException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String message, String symbol) {
        super(message, symbol);
    }

    public TypeMismatchException(String message, Throwable cause, String symbol) {
        super(message, cause, symbol);
    }
}
