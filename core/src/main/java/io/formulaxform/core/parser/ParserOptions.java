package io.formulaxform.core.parser;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Tuning knobs for a {@link Parser}.
 *
 * @param maxNestingDepth maximum parenthesis depth; deeper input fails fast with a parse error
 * @param literalCharset charset used to decode {@code \xHH} byte escapes in string literals
 */
public record ParserOptions(int maxNestingDepth, Charset literalCharset) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    public ParserOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        Objects.requireNonNull(literalCharset, "literalCharset must not be null");
    }

    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH, StandardCharsets.UTF_8);
    }

    public ParserOptions withMaxNestingDepth(int depth) {
        return new ParserOptions(depth, literalCharset);
    }

    public ParserOptions withLiteralCharset(Charset charset) {
        return new ParserOptions(maxNestingDepth, charset);
    }
}
