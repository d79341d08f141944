package io.formulaxform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulaxform.core.fields.FieldFormula;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, versioned formula loaded from a spec file.
 *
 * @param id unique formula identifier
 * @param version formula version, used in the {@code id@version} catalog key
 * @param description free text, may be {@code null}
 * @param lang id of the engine that compiled the formula
 * @param fields the record field identifiers the formula may reference
 * @param formula the compiled formula
 */
public record FormulaSpec(
        String id, String version, String description, String lang, List<String> fields, FieldFormula formula) {

    public FormulaSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(lang, "lang must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /** The formula text as written in the spec. */
    public String expression() {
        return formula.source();
    }

    public Object evaluate(Map<String, ?> record) {
        return formula.evaluate(record);
    }

    public Object evaluate(JsonNode record) {
        return formula.evaluate(record);
    }

    /** {@code id@version}. */
    public String key() {
        return id + "@" + version;
    }
}
