package io.formulaxform.core.fields;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lets field identifiers that are not valid bare identifiers, such as {@code body weight} or
 * {@code net-income}, appear in formula text. Each such identifier is given a placeholder name
 * ({@code X0}, {@code X1}, ...) and free-standing occurrences are rewritten to it before parsing.
 * Text inside single- or double-quoted literals is never touched.
 */
public final class IdentifierMapping {

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Quoted literals; matched first so that their contents are skipped. */
    private static final String QUOTED = "\"[^\"]+\"|'[^']+'";

    private static final String PLACEHOLDER_PREFIX = "X";

    private IdentifierMapping() {
        // static utility
    }

    /**
     * Maps every identifier to the name the formula will use for it, in encounter order.
     *
     * <p>Valid bare identifiers map to themselves. Every other identifier gets the next placeholder
     * that occurs nowhere in {@code text} outside quotes and is not itself one of {@code
     * identifiers}.
     */
    public static Map<String, String> build(String text, Collection<String> identifiers) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>(identifiers);
        int counter = 0;
        for (String identifier : identifiers) {
            if (mapping.containsKey(identifier)) {
                continue;
            }
            if (BARE_IDENTIFIER.matcher(identifier).matches()) {
                mapping.put(identifier, identifier);
                continue;
            }
            String placeholder = PLACEHOLDER_PREFIX + counter++;
            while (taken.contains(placeholder) || occursOutsideQuotes(text, placeholder)) {
                placeholder = PLACEHOLDER_PREFIX + counter++;
            }
            taken.add(placeholder);
            mapping.put(identifier, placeholder);
        }
        return Collections.unmodifiableMap(mapping);
    }

    /**
     * Replaces free-standing occurrences of each mapped identifier with its placeholder in a single
     * pass, longest identifier first. Identity mappings are ignored.
     */
    public static String rewrite(String text, Map<String, String> mapping) {
        List<String> targets = new ArrayList<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            if (!entry.getKey().equals(entry.getValue())) {
                targets.add(entry.getKey());
            }
        }
        if (targets.isEmpty()) {
            return text;
        }
        targets.sort(Comparator.comparingInt(String::length).reversed());
        List<String> alternatives = new ArrayList<>(targets.size());
        for (String target : targets) {
            alternatives.add(Pattern.quote(target));
        }
        Pattern pattern = Pattern.compile(QUOTED + "|(?<var>" + String.join("|", alternatives) + ")");
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String var = matcher.group("var");
            String replacement = var != null ? mapping.get(var) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Reverses a mapping: placeholder to original identifier. */
    public static Map<String, String> invert(Map<String, String> mapping) {
        Map<String, String> inverse = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            inverse.put(entry.getValue(), entry.getKey());
        }
        return Collections.unmodifiableMap(inverse);
    }

    private static boolean occursOutsideQuotes(String text, String name) {
        Matcher matcher = Pattern.compile(QUOTED + "|(?<var>" + Pattern.quote(name) + ")").matcher(text);
        while (matcher.find()) {
            if (matcher.group("var") != null) {
                return true;
            }
        }
        return false;
    }
}
