package io.formulaxform.core.parser;

import io.formulaxform.core.error.ExpressionParseException;
import io.formulaxform.core.model.Arguments;
import io.formulaxform.core.model.Expression;
import io.formulaxform.core.model.Rule;
import io.formulaxform.core.model.SymbolKind;
import io.formulaxform.core.model.Token;
import io.formulaxform.core.model.Vocabulary;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shunting-yard parser turning infix formula text into a postfix {@link Expression}.
 *
 * <p>A parser holds only its vocabulary and options; all scan state lives in a per-call {@link
 * Scan}. Instances are therefore reusable and safe to share between threads.
 *
 * <p>Operator priorities are offset by {@value #PAREN_STEP} per open parenthesis. A binary operator
 * pops stacked operators of greater or equal priority ({@code >} for right-associative operators)
 * but never past the innermost open parenthesis. Prefix unary operators and call markers are pushed
 * without popping. The comma binds loosest within its parentheses regardless of the priority its
 * vocabulary rule declares.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    static final int PRIMARY = 1;
    static final int OPERATOR = 2;
    static final int FUNCTION = 4;
    static final int LPAREN = 8;
    static final int RPAREN = 16;
    static final int COMMA = 32;
    static final int SIGN = 64;
    static final int CALL = 128;
    static final int NULLARY = 256;

    static final int PAREN_STEP = 10;
    static final int COMMA_PRIORITY = -1;

    private static final int OPERAND_START = PRIMARY | LPAREN | FUNCTION | SIGN;
    private static final int AFTER_OPERAND = OPERATOR | RPAREN | COMMA;
    private static final int AFTER_CALLABLE = AFTER_OPERAND | LPAREN | CALL;

    private final Vocabulary vocabulary;
    private final ParserOptions options;

    public Parser(Vocabulary vocabulary) {
        this(vocabulary, ParserOptions.defaults());
    }

    public Parser(Vocabulary vocabulary, ParserOptions options) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * Parses {@code text} into an expression bound to this parser's vocabulary.
     *
     * @throws ExpressionParseException with the 0-based column of the first problem
     */
    public Expression parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Token> tokens = new Scan(text).run();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed formula '{}' into {} tokens", text, tokens.size());
        }
        return new Expression(tokens, vocabulary);
    }

    /** Open parenthesis: operator-stack height when it opened, and whether it opened a call. */
    private record Paren(int floor, boolean call) {}

    /** State of a single parse. */
    private final class Scan {

        private final String text;
        private final List<Token> output = new ArrayList<>();
        private final List<Token> operators = new ArrayList<>();
        private final Deque<Paren> parens = new ArrayDeque<>();
        private int pos;
        private int expect = OPERAND_START;
        private int offset;
        private int balance;

        Scan(String text) {
            this.text = text;
        }

        List<Token> run() {
            while (pos < text.length()) {
                int start = pos;
                char c = text.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (text.startsWith("/*", pos)) {
                    skipComment(start);
                } else if ((expect & SIGN) != 0 && scanUnary()) {
                    expect = OPERAND_START;
                } else if (c == ',') {
                    scanComma(start);
                } else if (scanBinary(start)) {
                    // handled
                } else if (isDigit(c) || c == '.') {
                    require(PRIMARY, start, "unexpected number");
                    emitOperand(Token.constant(scanNumber(start)));
                } else if (c == '\'') {
                    require(PRIMARY, start, "unexpected string");
                    emitOperand(Token.constant(scanString(start)));
                } else if (scanConstant(start)) {
                    // handled
                } else if (c == '(') {
                    openParen(start);
                } else if (c == ')') {
                    closeParen(start);
                } else if (isWordStart(c) || c == '"') {
                    scanVariable(start);
                } else {
                    throw error(start, "unknown character '" + c + "'");
                }
            }
            if (!parens.isEmpty()) {
                throw error(text.length(), "unmatched parentheses");
            }
            while (!operators.isEmpty()) {
                output.add(pop());
            }
            if (output.isEmpty()) {
                throw error(text.length(), "empty expression");
            }
            if (balance != 1) {
                throw error(text.length(), "parity");
            }
            return output;
        }

        private void skipComment(int start) {
            int end = text.indexOf("*/", start + 2);
            if (end < 0) {
                throw error(start, "unterminated comment");
            }
            pos = end + 2;
        }

        private boolean scanUnary() {
            Rule rule = matchSymbol(vocabulary.get(SymbolKind.UNARY));
            if (rule == null) {
                return false;
            }
            pos += rule.name().length();
            operators.add(Token.unary(rule.name(), rule.priority() + offset));
            return true;
        }

        private boolean scanBinary(int start) {
            Rule rule = matchSymbol(vocabulary.get(SymbolKind.BINARY));
            if (rule == null) {
                return false;
            }
            if ((expect & OPERATOR) == 0) {
                if ("+".equals(rule.name())) {
                    pos++;
                    return true;
                }
                throw error(start, "unexpected operator '" + rule.name() + "'");
            }
            pos += rule.name().length();
            pushBinary(Token.binary(rule.name(), rule.priority() + offset), rule.rightAssociative());
            expect = OPERAND_START;
            return true;
        }

        private void scanComma(int start) {
            if ((expect & COMMA) == 0 || !vocabulary.contains(SymbolKind.BINARY, ",")) {
                throw error(start, "unexpected ','");
            }
            pos++;
            pushBinary(Token.binary(",", COMMA_PRIORITY + offset), false);
            expect = OPERAND_START;
        }

        private Object scanNumber(int start) {
            boolean dot = false;
            boolean digits = false;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '.') {
                    if (dot) {
                        throw error(pos, "unexpected '.'");
                    }
                    dot = true;
                } else if (isDigit(c)) {
                    digits = true;
                } else {
                    break;
                }
                pos++;
            }
            String literal = text.substring(start, pos);
            if (!digits) {
                throw error(start, "invalid number '" + literal + "'");
            }
            if (dot) {
                return Double.parseDouble(literal);
            }
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException e) {
                // beyond long range
                return Double.parseDouble(literal);
            }
        }

        private String scanString(int start) {
            int i = start + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (c == '\'') {
                    break;
                } else {
                    i++;
                }
            }
            if (i >= text.length()) {
                throw error(start, "unterminated string");
            }
            String raw = text.substring(start + 1, i);
            pos = i + 1;
            try {
                return StringLiterals.unescape(raw, options.literalCharset());
            } catch (IllegalArgumentException e) {
                throw error(start, "invalid string literal: " + e.getMessage());
            }
        }

        private boolean scanConstant(int start) {
            for (Map.Entry<String, Rule> entry : vocabulary.get(SymbolKind.CONSTANT).entrySet()) {
                String name = entry.getKey();
                if (text.startsWith(name, pos) && atBoundary(name, pos + name.length())) {
                    require(PRIMARY, start, "unexpected constant '" + name + "'");
                    pos += name.length();
                    emitOperand(Token.constant(entry.getValue().value()));
                    return true;
                }
            }
            return false;
        }

        private void openParen(int start) {
            require(LPAREN, start, "unexpected '('");
            boolean call = (expect & CALL) != 0;
            if (parens.size() >= options.maxNestingDepth()) {
                throw error(start, "nesting too deep (max " + options.maxNestingDepth() + ")");
            }
            parens.push(new Paren(operators.size(), call));
            offset += PAREN_STEP;
            pos++;
            expect = OPERAND_START | (call ? NULLARY : 0);
        }

        private void closeParen(int start) {
            if (parens.isEmpty()) {
                throw error(start, "unmatched parentheses");
            }
            if ((expect & NULLARY) != 0) {
                emitOperand(Token.constant(Arguments.EMPTY));
            } else {
                require(RPAREN, start, "unexpected ')'");
            }
            Paren paren = parens.pop();
            while (operators.size() > paren.floor()) {
                output.add(pop());
            }
            offset -= PAREN_STEP;
            if (paren.call()) {
                output.add(Token.call(offset));
                balance--;
            }
            pos++;
            expect = AFTER_CALLABLE;
        }

        private void scanVariable(int start) {
            String name;
            if (text.charAt(pos) == '"') {
                int end = text.indexOf('"', pos + 1);
                if (end < 0) {
                    throw error(start, "unterminated identifier");
                }
                name = text.substring(pos + 1, end);
                if (name.isEmpty()) {
                    throw error(start, "empty identifier");
                }
                pos = end + 1;
            } else {
                while (pos < text.length() && isWordPart(text.charAt(pos))) {
                    pos++;
                }
                name = text.substring(start, pos);
            }
            if (vocabulary.contains(SymbolKind.FUNCTION, name)) {
                require(FUNCTION, start, "unexpected function '" + name + "'");
            } else {
                require(PRIMARY, start, "unexpected variable '" + name + "'");
            }
            output.add(Token.variable(name));
            balance++;
            expect = AFTER_CALLABLE;
        }

        /** First rule (reverse lexicographic, so longest first) whose symbol starts at the cursor. */
        private Rule matchSymbol(Map<String, Rule> rules) {
            for (Map.Entry<String, Rule> entry : rules.entrySet()) {
                String name = entry.getKey();
                if (text.startsWith(name, pos) && atBoundary(name, pos + name.length())) {
                    return entry.getValue();
                }
            }
            return null;
        }

        private boolean atBoundary(String symbol, int end) {
            if (!isWordPart(symbol.charAt(symbol.length() - 1))) {
                return true;
            }
            return end >= text.length() || !isWordPart(text.charAt(end));
        }

        private void pushBinary(Token token, boolean rightAssociative) {
            int floor = parens.isEmpty() ? 0 : parens.peek().floor();
            while (operators.size() > floor) {
                int top = operators.get(operators.size() - 1).priority();
                boolean pops = rightAssociative ? top > token.priority() : top >= token.priority();
                if (!pops) {
                    break;
                }
                output.add(pop());
            }
            operators.add(token);
            balance--;
        }

        private void emitOperand(Token token) {
            output.add(token);
            balance++;
            expect = AFTER_OPERAND;
        }

        private Token pop() {
            return operators.remove(operators.size() - 1);
        }

        private void require(int state, int column, String reason) {
            if ((expect & state) == 0) {
                throw error(column, reason);
            }
        }

        private ExpressionParseException error(int column, String reason) {
            return new ExpressionParseException(column, reason);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
