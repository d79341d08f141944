package io.formulaxform.core.vocab;

import io.formulaxform.core.model.Arguments;
import io.formulaxform.core.model.Invocable;
import io.formulaxform.core.model.Rule;
import io.formulaxform.core.model.Vocabulary;
import java.util.Map;
import java.util.Set;

/**
 * Spreadsheet-style formulas kept for stored formula strings: {@code ^} is a real-valued power,
 * {@code ||} concatenates, and {@code iif(cond, a, b)} selects a value.
 *
 * <pre>
 *   6  ^  (right-associative)
 *   5  unary -
 *   4  / %
 *   3  *
 *   2  + -
 *   1  || == != &gt; &lt; &gt;= &lt;=
 *   0  and or
 * </pre>
 *
 * <p>Arithmetic, comparisons, the comma, {@code and}, {@code or}, {@code abs}, {@code round},
 * {@code min} and {@code max} are flagged builtin; everything else must be opted into.
 */
public final class LegacyVocabulary {

    private static final Set<String> BUILTIN_FUNCTIONS = Set.of("abs", "round", "min", "max");

    private LegacyVocabulary() {
        // static factory
    }

    public static Vocabulary create() {
        Vocabulary.Builder builder = Vocabulary.builder()
                .add(Rule.unary("-", Operators::neg, 5))
                .add(Rule.binary("+", Operators::add, 2))
                .add(Rule.binary("-", Operators::sub, 2))
                .add(Rule.binary("*", Operators::mul, 3))
                .add(Rule.binary("/", Operators::truediv, 4))
                .add(Rule.binary("%", Operators::mod, 4))
                .add(Rule.rightBinary("^", MathFunctions::power, 6).withBuiltin(false))
                .add(Rule.binary("||", Operators::concat, 1).withBuiltin(false))
                .add(Rule.binary("==", Operators::eq, 1))
                .add(Rule.binary("!=", Operators::ne, 1))
                .add(Rule.binary(">", Operators::gt, 1))
                .add(Rule.binary("<", Operators::lt, 1))
                .add(Rule.binary(">=", Operators::ge, 1))
                .add(Rule.binary("<=", Operators::le, 1))
                .add(Rule.binary(",", Arguments::append, 0))
                .add(Rule.binary("and", Operators::and, 0))
                .add(Rule.binary("or", Operators::or, 0));
        for (Map.Entry<String, Invocable> fn : MathFunctions.table().entrySet()) {
            boolean builtin = BUILTIN_FUNCTIONS.contains(fn.getKey());
            builder.add(Rule.function(fn.getKey(), fn.getValue(), 0).withBuiltin(builtin));
        }
        return builder.add(Rule.constant("E", Math.E).withBuiltin(false))
                .add(Rule.constant("PI", Math.PI).withBuiltin(false))
                .build();
    }
}
