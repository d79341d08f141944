package io.formulaxform.core.error;

/**
 * Thrown when the evaluation stack does not reduce to exactly one value. Expressions produced by
 * the parser never trigger this; hand-built token sequences can.
 */
public final class MalformedExpressionException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public MalformedExpressionException(String message) {
        super(message, null);
    }
}
