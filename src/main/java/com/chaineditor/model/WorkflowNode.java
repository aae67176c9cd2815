package com.chaineditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a workflow chain as the editor holds it.
 * {@code previousNodeName} is derived from chain order and recomputed on every settle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowNode {

    private String id;
    private String name;
    private String type;
    private String templateKey;
    private Map<String, ParameterValue> parameters = new LinkedHashMap<>();
    private JsonNode inputSchema;
    private JsonNode outputSchema;
    private String previousNodeName = "";
    private boolean minimized;

    public WorkflowNode() {
    }

    public WorkflowNode(String id, String name, String type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    /**
     * Deep copy; stores hand out copies so callers never mutate committed state.
     */
    public WorkflowNode copy() {
        WorkflowNode copy = new WorkflowNode(id, name, type);
        copy.templateKey = templateKey;
        copy.parameters = new LinkedHashMap<>(parameters);
        copy.inputSchema = inputSchema == null ? null : inputSchema.deepCopy();
        copy.outputSchema = outputSchema == null ? null : outputSchema.deepCopy();
        copy.previousNodeName = previousNodeName;
        copy.minimized = minimized;
        return copy;
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

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTemplateKey() {
        return templateKey;
    }

    public void setTemplateKey(String templateKey) {
        this.templateKey = templateKey;
    }

    public Map<String, ParameterValue> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, ParameterValue> parameters) {
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
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

    public String getPreviousNodeName() {
        return previousNodeName;
    }

    public void setPreviousNodeName(String previousNodeName) {
        this.previousNodeName = previousNodeName != null ? previousNodeName : "";
    }

    public boolean isMinimized() {
        return minimized;
    }

    public void setMinimized(boolean minimized) {
        this.minimized = minimized;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowNode)) return false;
        WorkflowNode other = (WorkflowNode) o;
        return minimized == other.minimized
            && Objects.equals(id, other.id)
            && Objects.equals(name, other.name)
            && Objects.equals(type, other.type)
            && Objects.equals(templateKey, other.templateKey)
            && Objects.equals(parameters, other.parameters)
            && Objects.equals(inputSchema, other.inputSchema)
            && Objects.equals(outputSchema, other.outputSchema)
            && Objects.equals(previousNodeName, other.previousNodeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, templateKey, parameters, previousNodeName, minimized);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
            "id='" + id + '\'' +
            ", name='" + name + '\'' +
            ", type='" + type + '\'' +
            ", previousNodeName='" + previousNodeName + '\'' +
            '}';
    }
}
