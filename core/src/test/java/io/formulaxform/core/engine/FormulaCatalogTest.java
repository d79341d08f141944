package io.formulaxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.formulaxform.core.error.FormulaSpecException;
import io.formulaxform.core.fields.FieldFormula;
import io.formulaxform.core.model.FormulaSpec;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FormulaCatalogTest {

    private static final EngineRegistry REGISTRY = EngineRegistry.standard();

    private static FormulaSpec spec(String id, String version, String expression) {
        var formula = FieldFormula.compile(REGISTRY.requireEngine(EngineRegistry.INFIX), expression, List.of());
        return new FormulaSpec(id, version, null, EngineRegistry.INFIX, List.of(), formula);
    }

    @Test
    void emptyCatalogFindsNothing() {
        var catalog = FormulaCatalog.empty();

        assertThat(catalog.size()).isZero();
        assertThat(catalog.find("anything")).isEmpty();
        assertThat(catalog.ids()).isEmpty();
    }

    @Test
    void specIsReachableByIdAndVersionedKey() {
        var v1 = spec("total", "1.0.0", "a + b");
        var catalog = FormulaCatalog.builder().add(v1).build();

        assertThat(catalog.find("total")).containsSame(v1);
        assertThat(catalog.find("total@1.0.0")).containsSame(v1);
        assertThat(catalog.size()).isEqualTo(2);
    }

    @Test
    void laterVersionWinsUnderBareId() {
        var v1 = spec("total", "1.0.0", "a + b");
        var v2 = spec("total", "2.0.0", "a + b + 1");
        var catalog = FormulaCatalog.builder().add(v1).add(v2).build();

        assertThat(catalog.require("total")).isSameAs(v2);
        assertThat(catalog.require("total@1.0.0")).isSameAs(v1);
        assertThat(catalog.ids()).containsExactly("total");
        assertThat(catalog.evaluate("total", Map.of("a", 1L, "b", 2L))).isEqualTo(4L);
        assertThat(catalog.evaluate("total@1.0.0", Map.of("a", 1L, "b", 2L))).isEqualTo(3L);
    }

    @Test
    void evaluatesAgainstJsonRecord() throws Exception {
        var catalog = FormulaCatalog.builder().add(spec("total", "1.0.0", "a * b")).build();
        var record = new ObjectMapper().readTree("{\"a\": 3, \"b\": 1.5, \"ignored\": \"x\"}");

        assertThat(catalog.evaluate("total", record)).isEqualTo(4.5);
    }

    @Test
    void requireUnknownFormulaThrows() {
        var catalog = FormulaCatalog.empty();

        assertThatThrownBy(() -> catalog.require("missing"))
                .isInstanceOfSatisfying(
                        FormulaSpecException.class, e -> assertThat(e.formulaId()).isEqualTo("missing"))
                .hasMessage("Unknown formula: 'missing'");
    }
}
