package io.formulaxform.core.error;

/**
 * Thrown when a variable has no binding and the vocabulary has no function or constant of that
 * name.
 */
public final class UndefinedSymbolException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public UndefinedSymbolException(String symbol) {
        super("undefined variable '" + symbol + "'", symbol);
    }

    public UndefinedSymbolException(String symbol, Throwable cause) {
        super("undefined variable '" + symbol + "'", cause, symbol);
    }
}
