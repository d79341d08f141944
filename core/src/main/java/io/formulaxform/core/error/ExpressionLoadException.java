package io.formulaxform.core.error;

/**
 * Abstract parent for errors raised while turning text into an expression: tokenizer and parser
 * failures, and formula spec files that cannot be loaded. Carries an additional {@code source}
 * field identifying the file or resource that caused the error.
 */
public abstract class ExpressionLoadException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ExpressionLoadException(String message, String source) {
        super(message, Phase.PARSE);
        this.source = source;
    }

    protected ExpressionLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.PARSE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} for inline text. */
    public String source() {
        return source;
    }
}
