package io.formulaxform.core.fields;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IdentifierMappingTest {

    @Test
    void bareIdentifiersMapToThemselves() {
        var mapping = IdentifierMapping.build("body weight / height ** 2", List.of("body weight", "height"));

        assertThat(mapping).containsExactly(Map.entry("body weight", "X0"), Map.entry("height", "height"));
    }

    @Test
    void placeholdersAvoidNamesAlreadyInText() {
        var mapping = IdentifierMapping.build("X0 + net-income", List.of("net-income"));

        assertThat(mapping).containsEntry("net-income", "X1");
        assertThat(IdentifierMapping.rewrite("X0 + net-income", mapping)).isEqualTo("X0 + X1");
    }

    @Test
    void placeholdersAvoidOtherIdentifiers() {
        var mapping = IdentifierMapping.build("a-b + X0", List.of("a-b", "X0"));

        assertThat(mapping).containsEntry("a-b", "X1").containsEntry("X0", "X0");
    }

    @Test
    void placeholderInsideQuotesDoesNotCount() {
        var mapping = IdentifierMapping.build("'X0' || net-income", List.of("net-income"));

        assertThat(mapping).containsEntry("net-income", "X0");
    }

    @Test
    void quotedLiteralsAreNotRewritten() {
        var mapping = Map.of("body weight", "X0");

        assertThat(IdentifierMapping.rewrite("'body weight' || body weight", mapping))
                .isEqualTo("'body weight' || X0");
    }

    @Test
    void longestIdentifierIsRewrittenFirst() {
        var mapping = IdentifierMapping.build("a b c + a b", List.of("a b", "a b c"));

        assertThat(IdentifierMapping.rewrite("a b c + a b", mapping)).isEqualTo("X1 + X0");
    }

    @Test
    void identityMappingLeavesTextUntouched() {
        String text = "x + y";

        assertThat(IdentifierMapping.rewrite(text, Map.of("x", "x"))).isSameAs(text);
    }

    @Test
    void invertSwapsKeysAndValues() {
        assertThat(IdentifierMapping.invert(Map.of("body weight", "X0"))).containsExactly(Map.entry("X0", "body weight"));
    }
}
