package io.formulaxform.core.fields;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulaxform.core.engine.JsonValues;
import io.formulaxform.core.error.UndefinedSymbolException;
import io.formulaxform.core.spi.CompiledExpression;
import io.formulaxform.core.spi.ExpressionEngine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A formula over record fields whose identifiers may not be valid bare identifiers. Used for
 * column transforms ({@code "body weight" / height ** 2}) and relation filters.
 *
 * <p>The text is rewritten through an {@link IdentifierMapping} and compiled once; each {@code
 * evaluate} call binds the record's field values to the placeholder names.
 *
 * <p>Immutable and thread-safe when the compiled expression is.
 */
public final class FieldFormula {

    private final String source;
    private final String rewritten;
    private final Map<String, String> mapping;
    private final Map<String, String> inverse;
    private final CompiledExpression compiled;

    private FieldFormula(String source, String rewritten, Map<String, String> mapping, CompiledExpression compiled) {
        this.source = source;
        this.rewritten = rewritten;
        this.mapping = mapping;
        this.inverse = IdentifierMapping.invert(mapping);
        this.compiled = compiled;
    }

    /**
     * Rewrites {@code text} for the given field identifiers and compiles it.
     *
     * @throws io.formulaxform.core.error.ExpressionParseException if the rewritten text does not
     *     parse
     */
    public static FieldFormula compile(ExpressionEngine engine, String text, Collection<String> fields) {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Map<String, String> mapping = IdentifierMapping.build(text, fields == null ? List.of() : fields);
        String rewritten = IdentifierMapping.rewrite(text, mapping);
        return new FieldFormula(text, rewritten, mapping, engine.compile(rewritten));
    }

    /**
     * Evaluates against a record keyed by original field identifier. Every key is bound under its
     * own name, so a double-quoted reference such as {@code "body weight"} resolves too; mapped
     * fields are also bound under their placeholder.
     *
     * @throws UndefinedSymbolException naming the original field if a referenced field is missing
     */
    public Object evaluate(Map<String, ?> record) {
        Map<String, Object> bindings = new HashMap<>();
        bindings.putAll(record);
        // placeholders win over record keys of the same name
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            String placeholder = mapping.get(entry.getKey());
            if (placeholder != null) {
                bindings.put(placeholder, entry.getValue());
            }
        }
        try {
            return compiled.evaluate(bindings);
        } catch (UndefinedSymbolException e) {
            String original = inverse.get(e.symbol());
            if (original == null || original.equals(e.symbol())) {
                throw e;
            }
            throw new UndefinedSymbolException(original, e);
        }
    }

    /** Evaluates against the fields of a JSON object. */
    public Object evaluate(JsonNode record) {
        return evaluate(JsonValues.toBindings(record));
    }

    /** Evaluates against the fields of a JSON object and returns the result as JSON. */
    public JsonNode evaluateToJson(JsonNode record) {
        return JsonValues.toJson(evaluate(record));
    }

    /** The original identifiers the formula reads, in order of first appearance. */
    public List<String> fields() {
        List<String> out = new ArrayList<>();
        for (String variable : compiled.variables()) {
            out.add(inverse.getOrDefault(variable, variable));
        }
        return Collections.unmodifiableList(out);
    }

    public String source() {
        return source;
    }

    /** The text actually handed to the engine. */
    public String rewritten() {
        return rewritten;
    }

    /** Original identifier to formula name. */
    public Map<String, String> mapping() {
        return mapping;
    }

    public CompiledExpression compiled() {
        return compiled;
    }

    @Override
    public String toString() {
        return "FieldFormula[" + source + "]";
    }
}
