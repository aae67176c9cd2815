package com.chaineditor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParameterValueJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void tokenStringIsReadAsReference() throws Exception {
        String json = "{\"name\":\"Sink\",\"type\":\"sink\",\"position\":2,"
            + "\"parameters\":{\"items\":\"={{ $('Fetch').output}}\",\"limit\":5}}";

        SubmittedNode node = mapper.readValue(json, SubmittedNode.class);

        assertEquals(ParameterValue.reference("Fetch", ".output"), node.getParameters().get("items"));
        assertFalse(node.getParameters().get("limit").isReference());
    }

    @Test
    void lookalikeStringStaysLiteral() throws Exception {
        String json = "{\"parameters\":{\"note\":\"use ={{ $('Fetch').output}} here\"}}";

        SubmittedNode node = mapper.readValue(json, SubmittedNode.class);

        ParameterValue note = node.getParameters().get("note");
        assertFalse(note.isReference());
        assertEquals("use ={{ $('Fetch').output}} here", ((ParameterValue.Literal) note).getValue().textValue());
    }

    @Test
    void referenceIsWrittenAsTokenString() throws Exception {
        WorkflowNode node = new WorkflowNode("n1", "Sink", "sink");
        node.getParameters().put("items", ParameterValue.reference("Fetch", ".items[0]"));
        node.getParameters().put("tags", ParameterValue.literal(mapper.readTree("[\"a\",\"b\"]")));

        JsonNode tree = mapper.readTree(mapper.writeValueAsString(node));

        assertEquals("={{ $('Fetch').items[0]}}", tree.path("parameters").path("items").asText());
        assertTrue(tree.path("parameters").path("tags").isArray());
        assertEquals("n1", tree.path("id").asText());
    }

    @Test
    void nullParameterIsLiteralNull() throws Exception {
        SubmittedNode node = mapper.readValue("{\"parameters\":{\"x\":null}}", SubmittedNode.class);
        ParameterValue x = node.getParameters().get("x");
        assertNotNull(x);
        assertTrue(((ParameterValue.Literal) x).getValue().isNull());
    }
}
