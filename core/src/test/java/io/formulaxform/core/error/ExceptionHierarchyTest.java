package io.formulaxform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: two tiers, common fields, all concrete types. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void expressionExceptionIsAbstractAndRoot() {
        assertThat(ExpressionException.class).isAbstract();
        assertThat(ExpressionException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndEvalParentsAreAbstract() {
        assertThat(ExpressionLoadException.class).isAbstract();
        assertThat(ExpressionLoadException.class.getSuperclass()).isEqualTo(ExpressionException.class);
        assertThat(ExpressionEvalException.class).isAbstract();
        assertThat(ExpressionEvalException.class.getSuperclass()).isEqualTo(ExpressionException.class);
    }

    // --- Parse-phase exceptions ---

    @Test
    void parseExceptionCarriesColumnAndReason() {
        var ex = new ExpressionParseException(7, "unexpected number");

        assertThat(ex).isInstanceOf(ExpressionLoadException.class);
        assertThat(ex.column()).isEqualTo(7);
        assertThat(ex.reason()).isEqualTo("unexpected number");
        assertThat(ex.getMessage()).isEqualTo("parse error [column 7]: unexpected number");
        assertThat(ex.detail()).isEqualTo(ex.getMessage());
        assertThat(ex.phase()).isEqualTo(ExpressionException.Phase.PARSE);
        assertThat(ex.source()).isNull();
    }

    @Test
    void parseExceptionKeepsSourceAndCause() {
        var cause = new ExpressionParseException(1, "parity");
        var ex = new ExpressionParseException(1, "parity (formula 'f')", "/specs/f.yaml", cause);

        assertThat(ex.source()).isEqualTo("/specs/f.yaml");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.column()).isEqualTo(1);
    }

    @Test
    void formulaSpecExceptionExtendsLoadException() {
        var cause = new RuntimeException("io");
        var ex = new FormulaSpecException("bad yaml", cause, "bmi", "/specs/bmi.yaml");

        assertThat(ex).isInstanceOf(ExpressionLoadException.class);
        assertThat(ex.formulaId()).isEqualTo("bmi");
        assertThat(ex.source()).isEqualTo("/specs/bmi.yaml");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.phase()).isEqualTo(ExpressionException.Phase.PARSE);
    }

    // --- Evaluation-phase exceptions ---

    @Test
    void undefinedSymbolNamesTheSymbol() {
        var ex = new UndefinedSymbolException("x");

        assertThat(ex).isInstanceOf(ExpressionEvalException.class);
        assertThat(ex.symbol()).isEqualTo("x");
        assertThat(ex.getMessage()).isEqualTo("undefined variable 'x'");
        assertThat(ex.phase()).isEqualTo(ExpressionException.Phase.EVALUATION);
    }

    @Test
    void malformedExpressionHasNoSymbol() {
        var ex = new MalformedExpressionException("invalid expression");

        assertThat(ex).isInstanceOf(ExpressionEvalException.class);
        assertThat(ex.symbol()).isNull();
        assertThat(ex.phase()).isEqualTo(ExpressionException.Phase.EVALUATION);
    }

    @Test
    void typeMismatchKeepsCause() {
        var cause = new IllegalArgumentException("unsupported operand type(s)");
        var ex = new TypeMismatchException("operator '+' failed", cause, "+");

        assertThat(ex).isInstanceOf(ExpressionEvalException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.symbol()).isEqualTo("+");
    }

    @Test
    void allExceptionsAreUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(ExpressionParseException.class);
        assertThat(RuntimeException.class).isAssignableFrom(FormulaSpecException.class);
        assertThat(RuntimeException.class).isAssignableFrom(UndefinedSymbolException.class);
        assertThat(RuntimeException.class).isAssignableFrom(MalformedExpressionException.class);
        assertThat(RuntimeException.class).isAssignableFrom(TypeMismatchException.class);
    }
}
