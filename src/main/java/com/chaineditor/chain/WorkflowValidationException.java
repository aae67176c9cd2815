package com.chaineditor.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-level failures found before a chain is handed off, keyed by field path such as {@code nodes[1].name}.
 */
public class WorkflowValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public WorkflowValidationException(Map<String, String> fieldErrors) {
        super("Workflow validation failed: " + fieldErrors);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
