package com.chaineditor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A step definition from the catalog, the blueprint for inserted nodes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeTemplate {

    public static final String ARRAY_TYPE = "array";

    private String id;
    private String name;
    private String description;
    private String type;
    private JsonNode inputSchema;
    private JsonNode outputSchema;
    private JsonNode parameters; // {service, method, params}

    public NodeTemplate() {
    }

    public NodeTemplate(String id, String name, String type, JsonNode inputSchema) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.inputSchema = inputSchema;
    }

    /**
     * Default values from {@code inputSchema.properties[key].default}, in schema order.
     * A template without properties yields an empty map.
     */
    @JsonIgnore
    public Map<String, JsonNode> getDefaultParameters() {
        Map<String, JsonNode> defaults = new LinkedHashMap<>();
        JsonNode properties = schemaProperties();
        if (properties == null) {
            return defaults;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode def = field.getValue().get("default");
            if (def != null) {
                defaults.put(field.getKey(), def.deepCopy());
            }
        }
        return defaults;
    }

    /**
     * Keys whose declared type is "array"; these are wired to the predecessor's output on insert.
     */
    @JsonIgnore
    public List<String> getArrayParameterKeys() {
        List<String> keys = new ArrayList<>();
        JsonNode properties = schemaProperties();
        if (properties == null) {
            return keys;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ARRAY_TYPE.equals(field.getValue().path("type").asText(null))) {
                keys.add(field.getKey());
            }
        }
        return keys;
    }

    private JsonNode schemaProperties() {
        if (inputSchema == null) {
            return null;
        }
        JsonNode properties = inputSchema.get("properties");
        return properties != null && properties.isObject() ? properties : null;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public JsonNode getInputSchema() {
        return inputSchema;
    }

    public void setInputSchema(JsonNode inputSchema) {
        this.inputSchema = inputSchema;
    }

    public JsonNode getOutputSchema() {
        return outputSchema;
    }

    public void setOutputSchema(JsonNode outputSchema) {
        this.outputSchema = outputSchema;
    }

    public JsonNode getParameters() {
        return parameters;
    }

    public void setParameters(JsonNode parameters) {
        this.parameters = parameters;
    }
}
