package io.formulaxform.core.model;

import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Immutable description of one vocabulary symbol: an operator, function, constant or variable
 * placeholder.
 *
 * <p>The {@code value} must match the kind: a {@link UnaryOperator} for {@link SymbolKind#UNARY},
 * a {@link BinaryOperator} for {@link SymbolKind#BINARY}, an {@link Invocable} for {@link
 * SymbolKind#FUNCTION}. Constants carry any literal (including {@code null}); variable rules carry
 * none.
 *
 * @param kind symbol kind
 * @param name the symbol as written in formula text, e.g. {@code "**"} or {@code "sqrt"}
 * @param value the callable or literal
 * @param priority binding strength; higher binds tighter
 * @param builtin {@code true} if the symbol is always available (see {@link
 *     Vocabulary#builtinsOnly()})
 * @param rightAssociative {@code true} for binary operators that group to the right
 */
public record Rule(
        SymbolKind kind, String name, Object value, int priority, boolean builtin, boolean rightAssociative) {

    public Rule {
        Objects.requireNonNull(kind, "kind must not be null");
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("rule name must not be null or empty");
        }
        switch (kind) {
            case UNARY -> requireValue(kind, name, value, UnaryOperator.class);
            case BINARY -> requireValue(kind, name, value, BinaryOperator.class);
            case FUNCTION -> requireValue(kind, name, value, Invocable.class);
            case VARIABLE -> {
                if (value != null) {
                    throw new IllegalArgumentException("variable rule '" + name + "' must not carry a value");
                }
            }
            case CONSTANT -> {
                // any literal, null included
            }
        }
        if (rightAssociative && kind != SymbolKind.BINARY) {
            throw new IllegalArgumentException("only binary rules can be right-associative: '" + name + "'");
        }
    }

    public static Rule unary(String name, UnaryOperator<Object> op, int priority) {
        return new Rule(SymbolKind.UNARY, name, op, priority, true, false);
    }

    public static Rule binary(String name, BinaryOperator<Object> op, int priority) {
        return new Rule(SymbolKind.BINARY, name, op, priority, true, false);
    }

    public static Rule rightBinary(String name, BinaryOperator<Object> op, int priority) {
        return new Rule(SymbolKind.BINARY, name, op, priority, true, true);
    }

    public static Rule function(String name, Invocable fn, int priority) {
        return new Rule(SymbolKind.FUNCTION, name, fn, priority, true, false);
    }

    public static Rule constant(String name, Object value) {
        return new Rule(SymbolKind.CONSTANT, name, value, 0, true, false);
    }

    public static Rule variable(String name) {
        return new Rule(SymbolKind.VARIABLE, name, null, 0, true, false);
    }

    /** Returns a copy of this rule with the given builtin flag. */
    public Rule withBuiltin(boolean flag) {
        return new Rule(kind, name, value, priority, flag, rightAssociative);
    }

    /** {@code true} if the name is made of letters, e.g. {@code and}, so it needs a word boundary. */
    public boolean isWord() {
        return Character.isLetter(name.charAt(0));
    }

    @SuppressWarnings("unchecked")
    public UnaryOperator<Object> unaryOperator() {
        return (UnaryOperator<Object>) value;
    }

    @SuppressWarnings("unchecked")
    public BinaryOperator<Object> binaryOperator() {
        return (BinaryOperator<Object>) value;
    }

    public Invocable invocable() {
        return (Invocable) value;
    }

    private static void requireValue(SymbolKind kind, String name, Object value, Class<?> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(kind + " rule '" + name + "' requires a " + type.getSimpleName()
                    + " value, got: " + (value == null ? "null" : value.getClass().getName()));
        }
    }
}
