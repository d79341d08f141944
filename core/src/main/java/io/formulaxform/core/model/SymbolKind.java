package io.formulaxform.core.model;

/** The kind of a vocabulary {@link Rule} or expression {@link Token}. */
public enum SymbolKind {
    UNARY,
    BINARY,
    FUNCTION,
    CONSTANT,
    VARIABLE
}
