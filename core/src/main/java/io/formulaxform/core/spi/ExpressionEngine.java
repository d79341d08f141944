package io.formulaxform.core.spi;

/**
 * Pluggable expression engine SPI. Each implementation offers one formula dialect (infix, builtins,
 * legacy, ...) and is registered with an {@code EngineRegistry} under its {@link #id()}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "infix"}, {@code "legacy"}. This id is used in
     * formula spec YAML files as the {@code lang} field to select the engine.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the given formula text into an immutable, thread-safe handle.
     *
     * @param expression the formula source text
     * @return a compiled expression ready for evaluation
     * @throws io.formulaxform.core.error.ExpressionParseException if the text has syntax errors
     */
    CompiledExpression compile(String expression);
}
