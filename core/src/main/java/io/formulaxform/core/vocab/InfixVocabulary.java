package io.formulaxform.core.vocab;

import io.formulaxform.core.model.Arguments;
import io.formulaxform.core.model.Rule;
import io.formulaxform.core.model.Vocabulary;

/**
 * Arithmetic, bitwise, comparison and boolean operators with conventional precedence.
 *
 * <pre>
 *   9  **  (right-associative)
 *   8  unary + - ~    @ / // % *
 *   7  + -
 *   6  &gt;&gt; &lt;&lt;
 *   5  &amp;
 *   4  ^  (exclusive or)
 *   3  |
 *   2  == != &gt; &lt; &gt;= &lt;= in is
 *   1  not  and
 *   0  or
 * </pre>
 *
 * <p>The comma is registered at priority 12 for completeness; the parser always binds it loosest.
 */
public final class InfixVocabulary {

    private InfixVocabulary() {
        // static factory
    }

    public static Vocabulary create() {
        return rules().build();
    }

    /** The rule set as an open builder, for vocabularies that extend it. */
    static Vocabulary.Builder rules() {
        return Vocabulary.builder()
                .add(Rule.binary(",", Arguments::append, 12))
                .add(Rule.unary("+", Operators::pos, 8))
                .add(Rule.unary("-", Operators::neg, 8))
                .add(Rule.unary("~", Operators::invert, 8))
                .add(Rule.rightBinary("**", Operators::pow, 9))
                .add(Rule.binary("@", Operators::matmul, 8))
                .add(Rule.binary("/", Operators::truediv, 8))
                .add(Rule.binary("//", Operators::floordiv, 8))
                .add(Rule.binary("%", Operators::mod, 8))
                .add(Rule.binary("*", Operators::mul, 8))
                .add(Rule.binary("+", Operators::add, 7))
                .add(Rule.binary("-", Operators::sub, 7))
                .add(Rule.binary(">>", Operators::rshift, 6))
                .add(Rule.binary("<<", Operators::lshift, 6))
                .add(Rule.binary("&", Operators::bitAnd, 5))
                .add(Rule.binary("^", Operators::bitXor, 4))
                .add(Rule.binary("|", Operators::bitOr, 3))
                .add(Rule.binary("==", Operators::eq, 2))
                .add(Rule.binary("!=", Operators::ne, 2))
                .add(Rule.binary(">", Operators::gt, 2))
                .add(Rule.binary("<", Operators::lt, 2))
                .add(Rule.binary(">=", Operators::ge, 2))
                .add(Rule.binary("<=", Operators::le, 2))
                .add(Rule.binary("in", Operators::in, 2))
                .add(Rule.binary("is", Operators::is, 2))
                .add(Rule.unary("not", Operators::not, 1))
                .add(Rule.binary("and", Operators::and, 1))
                .add(Rule.binary("or", Operators::or, 0));
    }
}
