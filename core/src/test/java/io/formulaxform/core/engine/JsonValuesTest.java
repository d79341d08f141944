package io.formulaxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValuesTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void scalarsBecomePlainValues() throws Exception {
        assertThat(JsonValues.toValue(JSON.readTree("42"))).isEqualTo(42L);
        assertThat(JsonValues.toValue(JSON.readTree("4.5"))).isEqualTo(4.5);
        assertThat(JsonValues.toValue(JSON.readTree("true"))).isEqualTo(true);
        assertThat(JsonValues.toValue(JSON.readTree("\"x\""))).isEqualTo("x");
        assertThat(JsonValues.toValue(JSON.readTree("null"))).isNull();
        assertThat(JsonValues.toValue(MissingNode.getInstance())).isNull();
        assertThat(JsonValues.toValue(JSON.readTree("123456789012345678901234567890"))).isInstanceOf(Double.class);
    }

    @Test
    void containersBecomeListsAndMaps() throws Exception {
        var value = JsonValues.toValue(JSON.readTree("{\"a\": [1, 2], \"b\": {\"c\": null}}"));

        assertThat(value).isInstanceOf(Map.class);
        var map = (Map<?, ?>) value;
        assertThat(map.get("a")).isEqualTo(List.of(1L, 2L));
        var nested = (Map<?, ?>) map.get("b");
        assertThat(nested.containsKey("c")).isTrue();
        assertThat(nested).hasSize(1);
        assertThat(nested.get("c")).isNull();
    }

    @Test
    void bindingsOfNonObjectAreEmpty() throws Exception {
        assertThat(JsonValues.toBindings(JSON.readTree("[1]"))).isEmpty();
        assertThat(JsonValues.toBindings(null)).isEmpty();
    }

    @Test
    void bindingsKeepDocumentOrder() throws Exception {
        assertThat(JsonValues.toBindings(JSON.readTree("{\"z\": 1, \"a\": 2}")).keySet()).containsExactly("z", "a");
    }

    @Test
    void resultsConvertBackToJson() throws Exception {
        assertThat(JsonValues.toJson(null).isNull()).isTrue();
        assertThat(JsonValues.toJson(3L).longValue()).isEqualTo(3L);
        assertThat(JsonValues.toJson(2.5)).isEqualTo(JSON.readTree("2.5"));
        assertThat(JsonValues.toJson(List.of("a", true))).hasToString("[\"a\",true]");
        assertThat(JsonValues.toJson(Map.of("k", 1L))).hasToString("{\"k\":1}");
        assertThat(JsonValues.toJson(new StringBuilder("sb")).textValue()).isEqualTo("sb");
    }
}
