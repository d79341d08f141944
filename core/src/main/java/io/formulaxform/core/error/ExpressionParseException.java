package io.formulaxform.core.error;

/**
 * Thrown when formula text cannot be tokenized or parsed. The {@link #column()} is the 0-based
 * index into the parsed text at which the problem was detected, so that an editor can highlight
 * the offending character.
 */
public final class ExpressionParseException extends ExpressionLoadException {

    private static final long serialVersionUID = 1L;

    private final int column;
    private final String reason;

    public ExpressionParseException(int column, String reason) {
        this(column, reason, null);
    }

    public ExpressionParseException(int column, String reason, String source) {
        super(format(column, reason), source);
        this.column = column;
        this.reason = reason;
    }

    public ExpressionParseException(int column, String reason, String source, Throwable cause) {
        super(format(column, reason), cause, source);
        this.column = column;
        this.reason = reason;
    }

    /** The 0-based scan column where parsing failed. */
    public int column() {
        return column;
    }

    /** The reason without the column prefix, e.g. {@code unexpected number}. */
    public String reason() {
        return reason;
    }

    private static String format(int column, String reason) {
        return "parse error [column " + column + "]: " + reason;
    }
}
