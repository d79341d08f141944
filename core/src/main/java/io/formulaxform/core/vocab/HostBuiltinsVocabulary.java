package io.formulaxform.core.vocab;

import io.formulaxform.core.model.Invocable;
import io.formulaxform.core.model.Rule;
import io.formulaxform.core.model.Vocabulary;
import java.util.Map;

/**
 * The infix operators plus a fixed table of general-purpose functions ({@code len}, {@code max},
 * {@code sorted}, ...) and the constants {@code True}, {@code False} and {@code None}.
 */
public final class HostBuiltinsVocabulary {

    /** Priority of every builtin function rule. */
    public static final int FUNCTION_PRIORITY = 11;

    private HostBuiltinsVocabulary() {
        // static factory
    }

    public static Vocabulary create() {
        Vocabulary.Builder builder = InfixVocabulary.rules();
        for (Map.Entry<String, Invocable> fn : BuiltinFunctions.table().entrySet()) {
            builder.add(Rule.function(fn.getKey(), fn.getValue(), FUNCTION_PRIORITY));
        }
        return builder.add(Rule.constant("True", Boolean.TRUE))
                .add(Rule.constant("False", Boolean.FALSE))
                .add(Rule.constant("None", null))
                .build();
    }
}
