package io.formulaxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulaxform.core.model.Expression;
import io.formulaxform.core.model.SymbolKind;
import io.formulaxform.core.spi.CompiledExpression;
import io.formulaxform.core.spi.ExpressionEngine;
import io.formulaxform.core.vocab.InfixVocabulary;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EngineRegistryTest {

    /** Trivial engine that ignores its input. */
    private static ExpressionEngine constantEngine(String id, Object result) {
        return new ExpressionEngine() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public CompiledExpression compile(String expression) {
                return new CompiledExpression() {
                    @Override
                    public Object evaluate(Map<String, ?> bindings) {
                        return result;
                    }

                    @Override
                    public List<String> variables() {
                        return List.of();
                    }
                };
            }
        };
    }

    @Test
    void standardRegistryHasThreeDialects() {
        var registry = EngineRegistry.standard();

        assertThat(registry.ids()).containsExactly("builtins", "infix", "legacy");
        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.requireEngine(EngineRegistry.LEGACY).compile("2 ^ 3").evaluate(Map.of()))
                .isEqualTo(8.0);
    }

    @Test
    void registerAndRetrieveEngine() {
        var registry = new EngineRegistry();
        var infix = new VocabularyExpressionEngine("infix", InfixVocabulary.create());
        registry.register(infix);

        assertThat(registry.getEngine("infix")).isPresent().hasValue(infix);
        assertThat(registry.requireEngine("infix")).isSameAs(infix);
        assertThat(registry.hasEngine("infix")).isTrue();
    }

    @Test
    void getEngineReturnsEmptyForUnknownId() {
        var registry = new EngineRegistry();

        assertThat(registry.getEngine("nonexistent")).isEmpty();
        assertThat(registry.hasEngine("nonexistent")).isFalse();
    }

    @Test
    void requireEngineThrowsForUnknownId() {
        var registry = new EngineRegistry();

        assertThatThrownBy(() -> registry.requireEngine("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonexistent");
    }

    @Test
    void registerDuplicateIdReplacesEngine() {
        var registry = new EngineRegistry();
        registry.register(constantEngine("custom", 1L));
        registry.register(constantEngine("custom", 2L));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.requireEngine("custom").compile("ignored").evaluate(Map.of())).isEqualTo(2L);
    }

    @Test
    void registerRejectsNullAndBlankIds() {
        var registry = new EngineRegistry();

        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register(constantEngine("", 0L)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void vocabularyEngineCompilesToExpression() {
        var engine = new VocabularyExpressionEngine("infix", InfixVocabulary.create());

        var compiled = engine.compile("a + b * c");

        assertThat(compiled).isInstanceOf(Expression.class);
        assertThat(compiled.variables()).containsExactly("a", "b", "c");
        assertThat(compiled.evaluate(Map.of("a", 1L, "b", 2L, "c", 3L))).isEqualTo(7L);
        assertThat(engine.vocabulary().contains(SymbolKind.BINARY, "**")).isTrue();
    }
}
