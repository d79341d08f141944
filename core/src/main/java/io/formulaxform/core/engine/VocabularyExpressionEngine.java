package io.formulaxform.core.engine;

import io.formulaxform.core.model.Expression;
import io.formulaxform.core.model.Vocabulary;
import io.formulaxform.core.parser.Parser;
import io.formulaxform.core.parser.ParserOptions;
import io.formulaxform.core.spi.ExpressionEngine;
import java.util.Objects;

/**
 * An {@link ExpressionEngine} backed by a {@link Vocabulary}. Compiling is parsing; the resulting
 * {@link Expression} is the compiled handle.
 */
public final class VocabularyExpressionEngine implements ExpressionEngine {

    private final String id;
    private final Parser parser;

    public VocabularyExpressionEngine(String id, Vocabulary vocabulary) {
        this(id, vocabulary, ParserOptions.defaults());
    }

    public VocabularyExpressionEngine(String id, Vocabulary vocabulary, ParserOptions options) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.parser = new Parser(vocabulary, options);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Expression compile(String expression) {
        return parser.parse(expression);
    }

    public Vocabulary vocabulary() {
        return parser.vocabulary();
    }
}
