package io.formulaxform.core.error;

/** Thrown when a formula spec file is unreadable, malformed, or names an unknown engine. */
public final class FormulaSpecException extends ExpressionLoadException {

    private static final long serialVersionUID = 1L;

    private final String formulaId;

    public FormulaSpecException(String message, String formulaId, String source) {
        super(message, source);
        this.formulaId = formulaId;
    }

    public FormulaSpecException(String message, Throwable cause, String formulaId, String source) {
        super(message, cause, source);
        this.formulaId = formulaId;
    }

    /** The formula that triggered the error, or {@code null} if not yet identified. */
    public String formulaId() {
        return formulaId;
    }
}
