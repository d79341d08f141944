package io.formulaxform.core.model;

import io.formulaxform.core.error.ExpressionException;
import io.formulaxform.core.error.MalformedExpressionException;
import io.formulaxform.core.error.TypeMismatchException;
import io.formulaxform.core.error.UndefinedSymbolException;
import io.formulaxform.core.parser.Parser;
import io.formulaxform.core.spi.CompiledExpression;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed formula: a postfix token sequence bound to the {@link Vocabulary} it was parsed with.
 *
 * <p>Immutable and thread-safe. {@link #simplify(Map)} and {@link #subst(String, Expression)}
 * return new instances.
 */
public final class Expression implements CompiledExpression {

    /** Rendering rank of atoms: literals, variables, calls. */
    private static final int ATOM = Integer.MAX_VALUE;

    /** Rendering rank of the comma, which binds loosest inside its parentheses. */
    private static final int LIST = -1;

    private final List<Token> tokens;
    private final Vocabulary vocabulary;

    public Expression(List<Token> tokens, Vocabulary vocabulary) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens must not be null"));
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
    }

    /** The postfix token sequence. */
    public List<Token> tokens() {
        return tokens;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    @Override
    public Object evaluate(Map<String, ?> bindings) {
        return eval(bindings);
    }

    public Object eval() {
        return eval(Map.of());
    }

    /**
     * Evaluates the formula in one stack pass.
     *
     * <p>A variable is looked up in {@code bindings} first, then among the vocabulary's functions
     * (yielding the {@link Invocable} itself) and constants.
     *
     * @throws UndefinedSymbolException if a variable cannot be resolved
     * @throws TypeMismatchException if an operator or function rejects its operands
     * @throws MalformedExpressionException if the token sequence does not reduce to one value
     */
    public Object eval(Map<String, ?> bindings) {
        Map<String, ?> values = bindings == null ? Map.of() : bindings;
        List<Object> stack = new ArrayList<>();
        for (Token token : tokens) {
            switch (token.kind()) {
                case CONSTANT -> stack.add(token.value());
                case VARIABLE -> stack.add(resolve(token.name(), values));
                case UNARY -> {
                    requireOperands(stack, 1, token);
                    Object operand = pop(stack);
                    stack.add(applyUnary(token.name(), operand));
                }
                case BINARY -> {
                    requireOperands(stack, 2, token);
                    Object right = pop(stack);
                    Object left = pop(stack);
                    stack.add(applyBinary(token.name(), left, right));
                }
                case FUNCTION -> {
                    requireOperands(stack, 2, token);
                    Object argument = pop(stack);
                    Object callee = pop(stack);
                    stack.add(call(callee, argument));
                }
            }
        }
        if (stack.size() != 1) {
            throw new MalformedExpressionException(
                    "invalid expression: stack holds " + stack.size() + " values after evaluation");
        }
        return stack.get(0);
    }

    @Override
    public List<String> variables() {
        List<String> out = new ArrayList<>();
        for (String symbol : symbols()) {
            if (!vocabulary.contains(SymbolKind.FUNCTION, symbol)) {
                out.add(symbol);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /** Distinct variable-token names, functions included, in order of first appearance. */
    public List<String> symbols() {
        Set<String> seen = new LinkedHashSet<>();
        for (Token token : tokens) {
            if (token.kind() == SymbolKind.VARIABLE) {
                seen.add(token.name());
            }
        }
        return List.copyOf(seen);
    }

    public Expression simplify() {
        return simplify(Map.of());
    }

    /**
     * Partially evaluates the formula. Constants and bound variables are folded through unary and
     * binary operators; everything else, function calls included, is copied through.
     */
    public Expression simplify(Map<String, ?> bindings) {
        Map<String, ?> values = bindings == null ? Map.of() : bindings;
        List<Token> pending = new ArrayList<>();
        List<Token> out = new ArrayList<>();
        for (Token token : tokens) {
            SymbolKind kind = token.kind();
            if (kind == SymbolKind.CONSTANT) {
                pending.add(token);
            } else if (kind == SymbolKind.VARIABLE && values.containsKey(token.name())) {
                pending.add(Token.constant(values.get(token.name())));
            } else if (kind == SymbolKind.BINARY && pending.size() > 1) {
                Token right = pop(pending);
                Token left = pop(pending);
                pending.add(Token.constant(applyBinary(token.name(), left.value(), right.value())));
            } else if (kind == SymbolKind.UNARY && !pending.isEmpty()) {
                Token operand = pop(pending);
                pending.add(Token.constant(applyUnary(token.name(), operand.value())));
            } else {
                out.addAll(pending);
                pending.clear();
                out.add(token);
            }
        }
        out.addAll(pending);
        return new Expression(out, vocabulary);
    }

    /** Replaces every occurrence of variable {@code name} with {@code replacement}. */
    public Expression subst(String name, Expression replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        List<Token> out = new ArrayList<>();
        for (Token token : tokens) {
            if (token.kind() == SymbolKind.VARIABLE && token.name().equals(name)) {
                out.addAll(replacement.tokens);
            } else {
                out.add(token);
            }
        }
        return new Expression(out, vocabulary);
    }

    /** Parses {@code replacement} with this expression's vocabulary and substitutes it for {@code name}. */
    public Expression subst(String name, String replacement) {
        return subst(name, new Parser(vocabulary).parse(replacement));
    }

    @Override
    public String toString() {
        return toString(false);
    }

    /**
     * Renders the formula as infix text, adding parentheses only where precedence or associativity
     * require them.
     *
     * <p>Folded booleans print as the vocabulary's constant, or as {@code 1 == 1} / {@code 1 == 0}
     * when it has none. A folded {@code null} without a constant and a folded list ({@code [..]})
     * have no literal form and do not re-parse.
     *
     * @param portable if {@code true}, power operators are written {@code pow(a, b)} and {@code ||}
     *     as {@code concat(a, b)}
     */
    public String toString(boolean portable) {
        List<Fragment> stack = new ArrayList<>();
        for (Token token : tokens) {
            switch (token.kind()) {
                case CONSTANT -> stack.add(renderConstant(token.value()));
                case VARIABLE -> stack.add(new Fragment(renderName(token.name()), ATOM));
                case UNARY -> {
                    requireOperands(stack, 1, token);
                    stack.add(renderUnary(token.name(), pop(stack)));
                }
                case BINARY -> {
                    requireOperands(stack, 2, token);
                    Fragment right = pop(stack);
                    Fragment left = pop(stack);
                    stack.add(renderBinary(token.name(), left, right, portable));
                }
                case FUNCTION -> {
                    requireOperands(stack, 2, token);
                    Fragment argument = pop(stack);
                    Fragment callee = pop(stack);
                    stack.add(new Fragment(callee.wrapBelow(ATOM) + "(" + argument.text() + ")", ATOM));
                }
            }
        }
        if (stack.size() != 1) {
            throw new MalformedExpressionException(
                    "invalid expression: " + stack.size() + " fragments remain after rendering");
        }
        return stack.get(0).text();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression other)) {
            return false;
        }
        return tokens.equals(other.tokens) && vocabulary == other.vocabulary;
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    // ── Evaluation helpers ──

    private Object resolve(String name, Map<String, ?> values) {
        if (values.containsKey(name)) {
            return values.get(name);
        }
        Rule function = vocabulary.get(SymbolKind.FUNCTION).get(name);
        if (function != null) {
            return function.invocable();
        }
        Rule constant = vocabulary.get(SymbolKind.CONSTANT).get(name);
        if (constant != null) {
            return constant.value();
        }
        throw new UndefinedSymbolException(name);
    }

    private Object applyUnary(String name, Object operand) {
        Rule rule = vocabulary.rule(SymbolKind.UNARY, name).orElseThrow(() -> new UndefinedSymbolException(name));
        try {
            return rule.unaryOperator().apply(operand);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TypeMismatchException(
                    "operator '" + name + "' failed on " + describe(operand) + ": " + e.getMessage(), e, name);
        }
    }

    private Object applyBinary(String name, Object left, Object right) {
        Rule rule = vocabulary.rule(SymbolKind.BINARY, name).orElseThrow(() -> new UndefinedSymbolException(name));
        try {
            return rule.binaryOperator().apply(left, right);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TypeMismatchException(
                    "operator '" + name + "' failed on " + describe(left) + " and " + describe(right) + ": "
                            + e.getMessage(),
                    e,
                    name);
        }
    }

    private static Object call(Object callee, Object argument) {
        if (!(callee instanceof Invocable fn)) {
            throw new TypeMismatchException(describe(callee) + " is not callable", Token.CALL);
        }
        try {
            return fn.invoke(Arguments.spread(argument));
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TypeMismatchException("function call failed: " + e.getMessage(), e, Token.CALL);
        }
    }

    private static void requireOperands(List<?> stack, int needed, Token token) {
        if (stack.size() < needed) {
            throw new MalformedExpressionException("invalid expression: '" + token.name() + "' needs " + needed
                    + " operand(s), found " + stack.size());
        }
    }

    private static <T> T pop(List<T> stack) {
        return stack.remove(stack.size() - 1);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    // ── Rendering helpers ──

    private Fragment renderConstant(Object value) {
        if (value instanceof String s) {
            return new Fragment(quote(s), ATOM);
        }
        if (value == null || value instanceof Boolean) {
            Optional<Rule> constant = vocabulary.constantFor(value);
            if (constant.isPresent()) {
                return new Fragment(constant.get().name(), ATOM);
            }
            Optional<Rule> equality = vocabulary.rule(SymbolKind.BINARY, "==");
            if (value != null && equality.isPresent()) {
                // no literal for booleans; a comparison re-parses to the same value
                String text = Boolean.TRUE.equals(value) ? "1 == 1" : "1 == 0";
                return new Fragment(text, equality.get().priority());
            }
            return new Fragment(String.valueOf(value), ATOM);
        }
        if (value instanceof Arguments args) {
            List<String> parts = new ArrayList<>();
            for (Object item : args) {
                parts.add(renderConstant(item).text());
            }
            return new Fragment(String.join(", ", parts), args.size() > 1 ? LIST : ATOM);
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(renderConstant(item).text());
            }
            return new Fragment("[" + String.join(", ", parts) + "]", ATOM);
        }
        String text = value instanceof Double d ? renderDouble(d) : String.valueOf(value);
        if (text.startsWith("-")) {
            int rank = vocabulary.rule(SymbolKind.UNARY, "-").map(Rule::priority).orElse(ATOM);
            return new Fragment(text, rank);
        }
        return new Fragment(text, ATOM);
    }

    private Fragment renderUnary(String name, Fragment operand) {
        int priority = vocabulary.rule(SymbolKind.UNARY, name).map(Rule::priority).orElse(ATOM);
        // a binary operator of equal priority pops the prefix operator, so equal ranks need parentheses
        String inner = operand.wrapBelow(priority + 1);
        String separator = Character.isLetter(name.charAt(0)) ? " " : "";
        return new Fragment(name + separator + inner, priority);
    }

    private Fragment renderBinary(String name, Fragment left, Fragment right, boolean portable) {
        if (",".equals(name)) {
            return new Fragment(left.wrapBelow(LIST) + ", " + right.wrapBelow(LIST + 1), LIST);
        }
        Rule rule = vocabulary.rule(SymbolKind.BINARY, name).orElse(null);
        int priority = rule == null ? 0 : rule.priority();
        boolean rightAssociative = rule != null && rule.rightAssociative();
        if (portable && isPower(name, rightAssociative)) {
            return new Fragment("pow(" + left.text() + ", " + right.text() + ")", ATOM);
        }
        if (portable && "||".equals(name)) {
            return new Fragment("concat(" + left.text() + ", " + right.text() + ")", ATOM);
        }
        String l = rightAssociative ? left.wrapBelow(priority + 1) : left.wrapBelow(priority);
        String r = rightAssociative ? right.wrapBelow(priority) : right.wrapBelow(priority + 1);
        return new Fragment(l + " " + name + " " + r, priority);
    }

    private static boolean isPower(String name, boolean rightAssociative) {
        return "**".equals(name) || ("^".equals(name) && rightAssociative);
    }

    private String renderName(String name) {
        if (isSymbol(name)) {
            return '"' + name + '"';
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = Character.isLetterOrDigit(c) || c == '_' || c == '.';
            if (!ok || (i == 0 && Character.isDigit(c))) {
                return '"' + name + '"';
            }
        }
        return name;
    }

    /** {@code true} if a bare {@code name} would scan as an operator or a named constant. */
    private boolean isSymbol(String name) {
        return vocabulary.get(SymbolKind.UNARY).containsKey(name)
                || vocabulary.get(SymbolKind.BINARY).containsKey(name)
                || vocabulary.get(SymbolKind.CONSTANT).containsKey(name);
    }

    private static String renderDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        String plain = BigDecimal.valueOf(d).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('\'').toString();
    }

    /** Rendered text plus the binding rank of its outermost operator. */
    private record Fragment(String text, int rank) {

        String wrapBelow(int required) {
            return rank < required ? "(" + text + ")" : text;
        }
    }
}
