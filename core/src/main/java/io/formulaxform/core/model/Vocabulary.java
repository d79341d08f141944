package io.formulaxform.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable set of {@link Rule}s, unique per {@code (kind, name)}. Built once through {@link
 * Builder} and then shared freely between parsers, expressions and threads.
 *
 * <p>{@link #get(SymbolKind)} orders names in reverse lexicographic order, so a scan over the map
 * meets {@code >=} before {@code >} and {@code **} before {@code *}.
 */
public final class Vocabulary {

    private static final NavigableMap<String, Rule> NONE = Collections.unmodifiableNavigableMap(newRuleMap());

    private final Map<SymbolKind, NavigableMap<String, Rule>> rules;
    private final int size;

    private Vocabulary(Map<SymbolKind, NavigableMap<String, Rule>> source) {
        Map<SymbolKind, NavigableMap<String, Rule>> frozen = new EnumMap<>(SymbolKind.class);
        int count = 0;
        for (Map.Entry<SymbolKind, NavigableMap<String, Rule>> entry : source.entrySet()) {
            NavigableMap<String, Rule> copy = newRuleMap();
            copy.putAll(entry.getValue());
            frozen.put(entry.getKey(), Collections.unmodifiableNavigableMap(copy));
            count += copy.size();
        }
        this.rules = Collections.unmodifiableMap(frozen);
        this.size = count;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rules of the given kind keyed by name, in reverse lexicographic order. Empty if none. */
    public NavigableMap<String, Rule> get(SymbolKind kind) {
        return rules.getOrDefault(kind, NONE);
    }

    public Optional<Rule> rule(SymbolKind kind, String name) {
        return Optional.ofNullable(get(kind).get(name));
    }

    public boolean contains(SymbolKind kind, String name) {
        return get(kind).containsKey(name);
    }

    /** Total number of rules across all kinds. */
    public int size() {
        return size;
    }

    /**
     * Finds the constant whose value is exactly {@code value} (same class, equal). Used to print
     * {@code true} back as {@code True} in a vocabulary that spells it that way.
     */
    public Optional<Rule> constantFor(Object value) {
        for (Rule rule : get(SymbolKind.CONSTANT).values()) {
            if (sameValue(rule.value(), value)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /** A vocabulary holding only the rules flagged {@code builtin}. */
    public Vocabulary builtinsOnly() {
        Builder builder = builder();
        for (NavigableMap<String, Rule> byName : rules.values()) {
            for (Rule rule : byName.values()) {
                if (rule.builtin()) {
                    builder.add(rule);
                }
            }
        }
        return builder.build();
    }

    /** A builder pre-filled with this vocabulary's rules, for extension. */
    public Builder toBuilder() {
        Builder builder = builder();
        for (NavigableMap<String, Rule> byName : rules.values()) {
            builder.addAll(byName.values());
        }
        return builder;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<SymbolKind, NavigableMap<String, Rule>> entry : rules.entrySet()) {
            parts.add(entry.getKey() + "=" + entry.getValue().size());
        }
        return "Vocabulary" + parts;
    }

    private static boolean sameValue(Object candidate, Object value) {
        if (candidate == null || value == null) {
            return candidate == value;
        }
        return candidate.getClass() == value.getClass() && candidate.equals(value);
    }

    private static NavigableMap<String, Rule> newRuleMap() {
        return new TreeMap<>(Comparator.reverseOrder());
    }

    /** Mutable builder. Not thread-safe; {@link #build()} freezes a snapshot. */
    public static final class Builder {

        private final Map<SymbolKind, NavigableMap<String, Rule>> rules = new EnumMap<>(SymbolKind.class);

        private Builder() {}

        /** Adds the rule, replacing any rule with the same kind and name. */
        public Builder add(Rule rule) {
            Objects.requireNonNull(rule, "rule must not be null");
            rules.computeIfAbsent(rule.kind(), k -> newRuleMap()).put(rule.name(), rule);
            return this;
        }

        public Builder addAll(Collection<Rule> toAdd) {
            toAdd.forEach(this::add);
            return this;
        }

        public Builder remove(SymbolKind kind, String name) {
            NavigableMap<String, Rule> byName = rules.get(kind);
            if (byName != null) {
                byName.remove(name);
            }
            return this;
        }

        public Vocabulary build() {
            return new Vocabulary(rules);
        }
    }
}
