package io.formulaxform.core.model;

import java.util.Objects;

/**
 * One element of an {@link Expression}'s postfix sequence.
 *
 * <ul>
 *   <li>{@code CONSTANT}: literal in {@code value}, no name
 *   <li>{@code VARIABLE}, {@code UNARY}, {@code BINARY}: symbol in {@code name}
 *   <li>{@code FUNCTION}: the call marker, named {@value #CALL}
 * </ul>
 *
 * <p>{@code priority} is the operator's priority plus the parenthesis offset at the point it was
 * scanned; it only matters while parsing.
 */
public record Token(SymbolKind kind, String name, int priority, Object value) {

    /** Name of the call marker token. */
    public static final String CALL = "()";

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind != SymbolKind.CONSTANT && name == null) {
            throw new IllegalArgumentException(kind + " token requires a name");
        }
    }

    public static Token constant(Object value) {
        return new Token(SymbolKind.CONSTANT, null, 0, value);
    }

    public static Token variable(String name) {
        return new Token(SymbolKind.VARIABLE, name, 0, null);
    }

    public static Token unary(String name, int priority) {
        return new Token(SymbolKind.UNARY, name, priority, null);
    }

    public static Token binary(String name, int priority) {
        return new Token(SymbolKind.BINARY, name, priority, null);
    }

    public static Token call(int priority) {
        return new Token(SymbolKind.FUNCTION, CALL, priority, null);
    }

    public boolean isCall() {
        return kind == SymbolKind.FUNCTION;
    }
}
