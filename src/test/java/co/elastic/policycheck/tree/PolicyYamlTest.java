package co.elastic.policycheck.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PolicyYamlTest {
    @Test
    void expandsAliasesIntoIndependentCopies() {
        var document = PolicyYaml.parse(
            "outputs:\n  hosts: &ref_0\n    - https://elasticsearch:9200\n"
                + "exporters:\n  endpoints: *ref_0\n"
        );
        var hosts = document.get("outputs.hosts").value();
        var endpoints = document.get("exporters.endpoints").value();
        assertEquals(List.of("https://elasticsearch:9200"), endpoints);
        assertNotSame(hosts, endpoints);
    }

    @Test
    void emptyInputIsEmptyMap() {
        assertTrue(PolicyYaml.parse("").root().isEmpty());
        assertTrue(PolicyYaml.parse("\n# nothing here\n").root().isEmpty());
    }

    @Test
    void rejectsNonMapRoot() {
        var error = assertThrows(DocumentDecodeException.class, () -> PolicyYaml.parse("\n404 Not Found\n"));
        assertEquals(DocumentDecodeException.CODE, error.code());
        assertTrue(error.getMessage().startsWith("failed to decode policy"), error.getMessage());

        assertThrows(DocumentDecodeException.class, () -> PolicyYaml.parse("- a\n- b\n"));
    }

    @Test
    void rejectsMalformedYaml() {
        assertThrows(DocumentDecodeException.class, () -> PolicyYaml.parse("inputs: [a, b\n"));
    }

    @Test
    void rejectsDuplicateKeys() {
        assertThrows(DocumentDecodeException.class, () -> PolicyYaml.parse("id: a\nid: b\n"));
    }

    @Test
    void keepsTimestampsAsText() {
        var document = PolicyYaml.parse("created_at: 2024-05-22T10:00:00Z\n");
        assertEquals("2024-05-22T10:00:00Z", document.get("created_at").value());
    }

    @Test
    void readsFloatsAsDecimals() {
        var document = PolicyYaml.parse("ratio: 0.5\n");
        assertEquals(new BigDecimal("0.5"), document.get("ratio").value());
    }

    @Test
    void serializesWithSortedKeysAndQuotedStrings() {
        var document = PolicyYaml.parse("b: 1\na: x\nc:\n  componentid-10: true\n  componentid-2: false\n");
        assertEquals(
            "a: \"x\"\nb: 1\nc:\n  componentid-2: false\n  componentid-10: true\n",
            PolicyYaml.serialize(document)
        );
    }

    @Test
    void serializesListsWithIndicatorIndentation() {
        var document = PolicyYaml.parse("hosts:\n- a\n- b\n");
        assertEquals("hosts:\n  - \"a\"\n  - \"b\"\n", PolicyYaml.serialize(document));
    }

    @Test
    void serializedOutputParsesBackToTheSameTree() {
        var document = PolicyYaml.parse(
            "version: \"1.0\"\nenabled: \"true\"\nperiod: 10s\nratio: 1.50\ncount: 3\nempty: {}\nnone: []\n"
                + "nested:\n  - name: a\n    values: [1, 2]\n"
        );
        var reparsed = PolicyYaml.parse(PolicyYaml.serialize(document));
        assertEquals(document.root(), reparsed.root());
        assertInstanceOf(String.class, reparsed.get("version").value());
        assertInstanceOf(String.class, reparsed.get("enabled").value());
        assertEquals(Map.of(), reparsed.get("empty").value());
    }

    @Test
    void serializeIsStable() {
        var once = PolicyYaml.serialize(PolicyYaml.parse("z: [b, a]\ny:\n  x: 1\n"));
        var twice = PolicyYaml.serialize(PolicyYaml.parse(once));
        assertEquals(once, twice);
    }

    @Test
    void decodeRejectsMalformedUtf8() {
        assertEquals("name: é\n", PolicyYaml.decode("name: é\n".getBytes(StandardCharsets.UTF_8)));
        var error = assertThrows(
            DocumentDecodeException.class,
            () -> PolicyYaml.decode(new byte[] {'a', ':', ' ', (byte) 0xc3, '\n'})
        );
        assertTrue(error.getMessage().startsWith("failed to decode policy"), error.getMessage());
    }

    @Test
    void layoutWritesFlowInputAsBlockYamlInDeclarationOrder() {
        var document = PolicyYaml.parse("{\"receivers\": {\"otlp/b\": {}, \"otlp/a\": null}, \"note\": \"a\\nreceivers:\"}");
        String layout = PolicyYaml.layout(document);
        assertEquals("receivers:\n  otlp/b: {}\n  otlp/a: null\nnote: \"a\\nreceivers:\"\n", layout);
        assertEquals(document.root(), PolicyYaml.parse(layout).root());
    }
}
