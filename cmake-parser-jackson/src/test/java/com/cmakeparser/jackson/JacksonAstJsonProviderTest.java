package com.cmakeparser.jackson;

import com.cmakeparser.Parser;
import com.cmakeparser.Token;
import com.cmakeparser.TokenKind;
import com.cmakeparser.ast.*;
import com.cmakeparser.json.AstJsonException;
import com.cmakeparser.json.AstJsonProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static final String SCRIPT = String.join("\n",
        "# build script",
        "function(Add_Demo name)",
        "  if(NOT DEFINED name)",
        "    return()",
        "  elseif(name STREQUAL \"x\")",
        "    message([[bracket]])",
        "  endif()",
        "endfunction()",
        "foreach(item a;b)",
        "  if(item)",
        "    continue()",
        "  endif()",
        "endforeach()");

    private final AstJsonProvider provider = new JacksonAstJsonProvider();

    @Test
    @DisplayName("Provider is discovered through ServiceLoader")
    void testProviderLookup() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", AstJsonProvider.getProvider().getName());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testSerializeCommand() throws Exception {
        Node node = Parser.parse("message(STATUS \"hi\")").get(0);
        JsonNode json = new ObjectMapper().readTree(provider.getSerializer().serialize(node));

        assertEquals("Command", json.get("type").asText());
        assertEquals("message", json.get("identifier").asText());
        assertEquals(0, json.get("start").asInt());
        assertEquals(20, json.get("end").asInt());
        assertEquals("QUOTED", json.get("args").get(1).get("kind").asText());
        assertEquals("hi", json.get("args").get(1).get("value").asText());
    }

    @Test
    @DisplayName("Missing else branch is written as null")
    void testIfWithoutElse() throws Exception {
        Node node = Parser.parse("if(A)\nendif()").get(0);
        JsonNode json = new ObjectMapper().readTree(provider.getSerializer().serialize(node));

        assertEquals("If", json.get("type").asText());
        assertTrue(json.has("ifFalse"));
        assertTrue(json.get("ifFalse").isNull());
        assertEquals("UnparsedExpr", json.get("args").get("type").asText());
    }

    @Test
    void testCallSignature() throws Exception {
        Node node = Parser.parse("macro(Helper a b)\nendmacro()").get(0);
        JsonNode json = new ObjectMapper().readTree(provider.getSerializer().serializePretty(node));

        assertEquals("Macro", json.get("type").asText());
        assertEquals("CallSignature", json.get("args").get("type").asText());
        assertEquals("helper", json.get("args").get("name").asText());
        assertEquals(2, json.get("args").get("params").size());
    }

    @Test
    @DisplayName("Parsed tree survives a JSON round trip")
    void testRoundTrip() {
        List<Node> nodes = Parser.parse(SCRIPT);

        String json = provider.getSerializer().serializeNodes(nodes);
        List<Node> restored = provider.getDeserializer().deserializeNodes(json);

        assertEquals(nodes, restored);
    }

    @Test
    void testDeserializeSingleNode() {
        If node = (If) Parser.parse("if(A)\nelse()\nendif()").get(0);

        String json = provider.getSerializer().serialize(node);
        If restored = provider.getDeserializer().deserialize(json, If.class);

        assertEquals(node, restored);
        assertTrue(restored.hasElse());
    }

    @Test
    void testDeserializeWrongType() {
        String json = provider.getSerializer().serialize(Parser.parse("foo()").get(0));
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserialize(json, If.class));
    }

    @Test
    void testMalformedJson() {
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeNodes("[{\"type\":"));
        assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeNodes("[{\"type\":\"Unknown\"}]"));
    }

    @Test
    @DisplayName("Scanner output round trips, including an unparseable tail")
    void testTokensRoundTrip() throws Exception {
        List<Token> tokens = Parser.scan("foo(\"abc").collect(java.util.stream.Collectors.toList());
        assertEquals(TokenKind.UNPARSEABLE, tokens.get(2).kind());

        String json = provider.getSerializer().serializeTokens(tokens);
        assertTrue(new ObjectMapper().readTree(json).get(2).get("value").isNull());
        assertEquals(tokens, provider.getDeserializer().deserializeTokens(json));
    }

    @Test
    void testCustomObjectMapper() {
        ObjectMapper mapper = CMakeJackson.createObjectMapper()
            .enable(com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT);
        AstJsonProvider indenting = new JacksonAstJsonProvider(mapper);
        List<Node> nodes = Parser.parse("foreach(x a b)\n  message(${x})\nendforeach()");

        String json = indenting.getSerializer().serializeNodes(nodes);
        assertTrue(json.contains("\n"), json);
        assertEquals(nodes, indenting.getDeserializer().deserializeNodes(json));
    }

    @Test
    void testObjectMapperReadsNodeDirectly() throws Exception {
        ObjectMapper mapper = CMakeJackson.createObjectMapper();
        String json = """
            {
              "type": "Break",
              "start": 4,
              "end": 11,
              "line": 2,
              "column": 1,
              "extra": true
            }
            """;

        Node node = mapper.readValue(json, Node.class);
        assertEquals(new Break(4, 11, 2, 1), node);
    }
}
