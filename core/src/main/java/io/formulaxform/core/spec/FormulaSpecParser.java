package io.formulaxform.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formulaxform.core.engine.EngineRegistry;
import io.formulaxform.core.engine.FormulaCatalog;
import io.formulaxform.core.error.ExpressionParseException;
import io.formulaxform.core.error.FormulaSpecException;
import io.formulaxform.core.fields.FieldFormula;
import io.formulaxform.core.model.FormulaSpec;
import io.formulaxform.core.spi.ExpressionEngine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML formula spec files into {@link FormulaSpec} instances. Resolves the engine through
 * {@link EngineRegistry} and compiles the formula at load time, so a spec that loads is known to
 * parse.
 *
 * <pre>
 * id: bmi
 * version: "1.0.0"          # optional, default 1.0.0
 * description: Body mass index
 * lang: builtins            # optional, default legacy
 * fields: [body weight, height]
 * expression: body weight / height ** 2
 * </pre>
 *
 * <p>Thread-safe if the underlying {@link EngineRegistry} is (it is).
 */
public final class FormulaSpecParser {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaSpecParser.class);

    static final String DEFAULT_LANG = EngineRegistry.LEGACY;
    static final String DEFAULT_VERSION = "1.0.0";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Recognized top-level keys; anything else is rejected so typos fail at load time. */
    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("id", "version", "description", "lang", "fields", "expression");

    private final EngineRegistry engineRegistry;

    public FormulaSpecParser(EngineRegistry engineRegistry) {
        this.engineRegistry = Objects.requireNonNull(engineRegistry, "engineRegistry must not be null");
    }

    public EngineRegistry engineRegistry() {
        return engineRegistry;
    }

    /**
     * Parses the YAML file at the given path.
     *
     * @throws FormulaSpecException if the YAML is unreadable, has unknown keys, misses required
     *     fields or names an unregistered engine
     * @throws ExpressionParseException if the formula does not parse
     */
    public FormulaSpec parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();

        JsonNode root = readYaml(path, source);
        if (root == null || !root.isObject()) {
            throw new FormulaSpecException("Spec must be a YAML mapping", null, source);
        }

        String id = requireString(root, "id", null, source);
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, id, source);

        String version = optionalString(root, "version");
        String description = optionalString(root, "description");
        String lang = optionalString(root, "lang");
        if (lang == null) {
            lang = DEFAULT_LANG;
        }
        ExpressionEngine engine = resolveEngine(lang, id, source);
        List<String> fields = parseFields(root, id, source);
        String expression = requireString(root, "expression", id, source);

        FieldFormula formula = compile(engine, expression, fields, id, source);
        FormulaSpec spec = new FormulaSpec(
                id, version == null ? DEFAULT_VERSION : version, description, lang, fields, formula);
        LOG.info("Loaded formula spec: id={}, version={}, lang={}, source={}", id, spec.version(), lang, source);
        return spec;
    }

    /**
     * Loads every {@code *.yaml} and {@code *.yml} file in a directory, in file-name order. The
     * first failing file aborts the load.
     */
    public FormulaCatalog loadDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FormulaSpecException(
                    "Failed to list spec directory: " + e.getMessage(), e, null, directory.toString());
        }
        FormulaCatalog.Builder catalog = FormulaCatalog.builder();
        for (Path file : files) {
            catalog.add(parse(file));
        }
        LOG.info("Loaded {} formula spec(s) from {}", files.size(), directory);
        return catalog.build();
    }

    private JsonNode readYaml(Path path, String source) {
        try {
            return YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new FormulaSpecException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    private String requireString(JsonNode root, String field, String specId, String source) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new FormulaSpecException("Missing or invalid required field: '" + field + "'", specId, source);
        }
        return node.asText();
    }

    private String optionalString(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private List<String> parseFields(JsonNode root, String specId, String source) {
        JsonNode node = root.get("fields");
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new FormulaSpecException("'fields' must be a list of field identifiers", specId, source);
        }
        List<String> fields = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isValueNode() || item.isNull()) {
                throw new FormulaSpecException("'fields' entries must be scalars, got: " + item, specId, source);
            }
            fields.add(item.asText());
        }
        return fields;
    }

    private ExpressionEngine resolveEngine(String lang, String specId, String source) {
        return engineRegistry
                .getEngine(lang)
                .orElseThrow(() -> new FormulaSpecException(
                        "Unknown expression engine: '" + lang + "', registered: " + engineRegistry.ids(),
                        specId,
                        source));
    }

    private FieldFormula compile(
            ExpressionEngine engine, String expression, List<String> fields, String specId, String source) {
        try {
            return FieldFormula.compile(engine, expression, fields);
        } catch (ExpressionParseException e) {
            // Re-throw with spec context attached
            throw new ExpressionParseException(
                    e.column(), e.reason() + " (formula '" + specId + "')", source, e);
        }
    }

    private void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String specId, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new FormulaSpecException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in spec root: " + unknown
                            + "; recognized keys are: " + knownKeys,
                    specId,
                    source);
        }
    }
}
