package io.formulaxform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.formulaxform.core.error.FormulaSpecException;
import io.formulaxform.core.model.FormulaSpec;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of loaded formula specs, keyed by id and by {@code id@version}. A later spec
 * with the same id replaces the earlier one under the bare id; both stay reachable by versioned key.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class FormulaCatalog {

    private final Map<String, FormulaSpec> formulas;

    private FormulaCatalog(Map<String, FormulaSpec> formulas) {
        this.formulas = Collections.unmodifiableMap(new HashMap<>(formulas));
    }

    public static FormulaCatalog empty() {
        return new FormulaCatalog(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Looks up a formula by its id or its {@code id@version} key. */
    public Optional<FormulaSpec> find(String key) {
        return Optional.ofNullable(formulas.get(key));
    }

    /**
     * Looks up a formula, throwing if it is not loaded.
     *
     * @throws FormulaSpecException if no formula is registered under {@code key}
     */
    public FormulaSpec require(String key) {
        return find(key).orElseThrow(() -> new FormulaSpecException("Unknown formula: '" + key + "'", key, null));
    }

    /** Evaluates the formula registered under {@code key} against a record. */
    public Object evaluate(String key, Map<String, ?> record) {
        return require(key).evaluate(record);
    }

    /** Evaluates the formula registered under {@code key} against the fields of a JSON object. */
    public Object evaluate(String key, JsonNode record) {
        return require(key).evaluate(record);
    }

    /** Distinct formula ids, sorted. */
    public Set<String> ids() {
        Set<String> ids = new TreeSet<>();
        for (FormulaSpec spec : formulas.values()) {
            ids.add(spec.id());
        }
        return Collections.unmodifiableSet(ids);
    }

    /** Number of map entries, counting both the bare and the versioned key. */
    public int size() {
        return formulas.size();
    }

    /** Builder for a {@link FormulaCatalog}. */
    public static final class Builder {

        private final Map<String, FormulaSpec> formulas = new HashMap<>();

        Builder() {}

        /** Registers a formula under both its id and its {@code id@version} key. */
        public Builder add(FormulaSpec spec) {
            formulas.put(spec.id(), spec);
            formulas.put(spec.key(), spec);
            return this;
        }

        public FormulaCatalog build() {
            return new FormulaCatalog(formulas);
        }
    }
}
