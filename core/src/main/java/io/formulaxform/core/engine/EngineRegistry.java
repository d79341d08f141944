package io.formulaxform.core.engine;

import io.formulaxform.core.spi.ExpressionEngine;
import io.formulaxform.core.vocab.HostBuiltinsVocabulary;
import io.formulaxform.core.vocab.InfixVocabulary;
import io.formulaxform.core.vocab.LegacyVocabulary;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for expression engines. Manages engine registration and lookup by engine id.
 * Thread-safe; registration and lookup can happen concurrently.
 */
public final class EngineRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EngineRegistry.class);

    /** Engine id of the infix operator dialect. */
    public static final String INFIX = "infix";

    /** Engine id of the infix dialect with builtin functions. */
    public static final String BUILTINS = "builtins";

    /** Engine id of the spreadsheet-style legacy dialect. */
    public static final String LEGACY = "legacy";

    private final Map<String, ExpressionEngine> engines = new ConcurrentHashMap<>();

    /** A registry with the three standard dialects registered. */
    public static EngineRegistry standard() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new VocabularyExpressionEngine(INFIX, InfixVocabulary.create()));
        registry.register(new VocabularyExpressionEngine(BUILTINS, HostBuiltinsVocabulary.create()));
        registry.register(new VocabularyExpressionEngine(LEGACY, LegacyVocabulary.create()));
        return registry;
    }

    /**
     * Registers an expression engine. If an engine with the same id is already registered, it is
     * replaced (last-write-wins semantics).
     *
     * @param engine the expression engine to register
     * @throws NullPointerException if engine is null
     * @throws IllegalArgumentException if engine.id() is null or empty
     */
    public void register(ExpressionEngine engine) {
        if (engine == null) {
            throw new NullPointerException("engine must not be null");
        }
        String id = engine.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("engine id must not be null or empty");
        }
        ExpressionEngine previous = engines.put(id, engine);
        if (previous != null) {
            LOG.debug("Replaced expression engine '{}'", id);
        } else {
            LOG.debug("Registered expression engine '{}'", id);
        }
    }

    /**
     * Looks up an engine by id.
     *
     * @param engineId the engine identifier (e.g. "legacy")
     * @return the engine, or empty if not registered
     */
    public Optional<ExpressionEngine> getEngine(String engineId) {
        return Optional.ofNullable(engines.get(engineId));
    }

    /**
     * Looks up an engine by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no engine is registered with the given id
     */
    public ExpressionEngine requireEngine(String engineId) {
        return getEngine(engineId)
                .orElseThrow(() ->
                        new IllegalArgumentException("No expression engine registered for id: '" + engineId + "'"));
    }

    /** Returns the number of registered engines. */
    public int size() {
        return engines.size();
    }

    /** Returns {@code true} if an engine with the given id is registered. */
    public boolean hasEngine(String engineId) {
        return engines.containsKey(engineId);
    }

    /** Registered engine ids, sorted. */
    public Set<String> ids() {
        return new TreeSet<>(engines.keySet());
    }
}
