package io.formulaxform.core.spi;

import java.util.List;
import java.util.Map;

/**
 * An immutable, thread-safe compiled formula. Produced by {@link ExpressionEngine#compile(String)}
 * and evaluated any number of times against different variable bindings.
 */
public interface CompiledExpression {

    /**
     * Evaluates this formula against the given bindings.
     *
     * @param bindings variable values keyed by the names reported by {@link #variables()}
     * @return the computed value; {@code Long}, {@code Double}, {@code Boolean}, {@code String},
     *     {@code List} or whatever a vocabulary function returns
     * @throws io.formulaxform.core.error.ExpressionEvalException if evaluation fails
     */
    Object evaluate(Map<String, ?> bindings);

    /** The data variables the formula needs, in order of first appearance. */
    List<String> variables();
}
