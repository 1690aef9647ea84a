package io.bridgeconfig.core.canonical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CanonicalJson}. Expected strings are what Python's
 * {@code json.dumps(value, indent=4) + "\n"} produces for the same value.
 */
class CanonicalJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void emptyContainersStayOnOneLine() throws Exception {
        JsonNode node = MAPPER.readTree("{\"a\": {}, \"b\": []}");

        assertThat(CanonicalJson.write(node)).isEqualTo("""
                {
                    "a": {},
                    "b": []
                }
                """);
    }

    @Test
    void nestedContainersIndentByFourSpaces() throws Exception {
        JsonNode node = MAPPER.readTree("{\"outer\": {\"list\": [1, \"x\", true, null], \"n\": -3}}");

        assertThat(CanonicalJson.write(node)).isEqualTo("""
                {
                    "outer": {
                        "list": [
                            1,
                            "x",
                            true,
                            null
                        ],
                        "n": -3
                    }
                }
                """);
    }

    @Test
    void memberOrderIsInsertionOrder() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("z", 1);
        node.put("a", 2);

        assertThat(CanonicalJson.write(node)).isEqualTo("{\n    \"z\": 1,\n    \"a\": 2\n}\n");
    }

    @Test
    void topLevelScalarGetsTrailingNewline() {
        assertThat(CanonicalJson.write(MAPPER.getNodeFactory().textNode("x"))).isEqualTo("\"x\"\n");
    }

    @Test
    void integersBeyondLongRangeAreWrittenExactly() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("v", new BigInteger("123456789012345678901234567890"));

        assertThat(CanonicalJson.write(node)).isEqualTo("{\n    \"v\": 123456789012345678901234567890\n}\n");
    }

    @Test
    void nonAsciiIsEscapedWithLowerCaseHex() {
        StringBuilder out = new StringBuilder();
        CanonicalJson.writeString("USDCé€", out);

        assertThat(out).hasToString("\"USDC\\u00e9\\u20ac\"");
    }

    @Test
    void supplementaryCharactersAreEscapedAsSurrogatePairs() {
        StringBuilder out = new StringBuilder();
        CanonicalJson.writeString("😀", out);

        assertThat(out).hasToString("\"\\ud83d\\ude00\"");
    }

    @Test
    void controlCharactersUseShortEscapesWhereDefined() {
        StringBuilder out = new StringBuilder();
        CanonicalJson.writeString("\"\\\n\r\t\b\f\u0001\u007f/", out);

        assertThat(out).hasToString("\"\\\"\\\\\\n\\r\\t\\b\\f\\u0001\\u007f/\"");
    }

    @Test
    void floatingPointValuesAreRejected() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("v", 1.5);

        assertThatThrownBy(() -> CanonicalJson.write(node)).isInstanceOf(IllegalArgumentException.class);
    }
}
