package com.chaineditor.model;

import com.chaineditor.chain.ReferenceToken;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;

/**
 * Jackson mapping for {@link ParameterValue}. References are written as token strings;
 * a string is read back as a reference only when the whole string is one token.
 */
public final class ParameterValueJson {

    private ParameterValueJson() {
    }

    public static ParameterValue fromJson(JsonNode node) {
        if (node != null && node.isTextual()) {
            ParameterValue.Reference ref = ReferenceToken.parse(node.textValue());
            if (ref != null) {
                return ref;
            }
        }
        return ParameterValue.literal(node);
    }

    public static JsonNode toJson(ParameterValue value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value.isReference()) {
            return JsonNodeFactory.instance.textNode(ReferenceToken.format((ParameterValue.Reference) value));
        }
        return ((ParameterValue.Literal) value).getValue();
    }

    public static class Serializer extends JsonSerializer<ParameterValue> {
        @Override
        public void serialize(ParameterValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (value.isReference()) {
                gen.writeString(ReferenceToken.format((ParameterValue.Reference) value));
            } else {
                ((ParameterValue.Literal) value).getValue().serialize(gen, serializers);
            }
        }
    }

    public static class Deserializer extends JsonDeserializer<ParameterValue> {
        @Override
        public ParameterValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            return fromJson(node);
        }

        @Override
        public ParameterValue getNullValue(DeserializationContext ctxt) {
            return ParameterValue.literal(JsonNodeFactory.instance.nullNode());
        }
    }
}
