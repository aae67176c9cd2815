package com.chaineditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node as handed to persistence and execution: UI-only fields stripped, 1-based position.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmittedNode {

    private String name;
    private String type;
    private Map<String, ParameterValue> parameters = new LinkedHashMap<>();
    private int position;

    public SubmittedNode() {
    }

    public SubmittedNode(String name, String type, Map<String, ParameterValue> parameters, int position) {
        this.name = name;
        this.type = type;
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        this.position = position;
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

    public Map<String, ParameterValue> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, ParameterValue> parameters) {
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }
}
