package com.chaineditor.chain;

import com.chaineditor.model.ParameterValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Points back-references at a new predecessor name. Only the name changes;
 * path suffix and quote style are kept as written.
 */
public final class ReferenceRewriter {

    private ReferenceRewriter() {
    }

    /**
     * Rewrite every reference in {@code parameters} to name {@code newPreviousName}.
     * Literals pass through untouched. Returns a new map in the original key order.
     */
    public static Map<String, ParameterValue> rewriteReferences(Map<String, ParameterValue> parameters,
                                                              String newPreviousName) {
        Map<String, ParameterValue> result = new LinkedHashMap<>();
        if (parameters == null) {
            return result;
        }
        String name = newPreviousName == null ? "" : newPreviousName;
        for (Map.Entry<String, ParameterValue> entry : parameters.entrySet()) {
            ParameterValue value = entry.getValue();
            if (value != null && value.isReference()) {
                value = ((ParameterValue.Reference) value).withNodeName(name);
            }
            result.put(entry.getKey(), value);
        }
        return result;
    }

    /**
     * Count of references in {@code parameters} that do not yet name {@code newPreviousName}.
     */
    public static int countStale(Map<String, ParameterValue> parameters, String newPreviousName) {
        if (parameters == null) {
            return 0;
        }
        String name = newPreviousName == null ? "" : newPreviousName;
        int stale = 0;
        for (ParameterValue value : parameters.values()) {
            if (value != null && value.isReference()
                    && !name.equals(((ParameterValue.Reference) value).getNodeName())) {
                stale++;
            }
        }
        return stale;
    }

    /**
     * String form of the rewrite, for raw values that never went through the typed model.
     * A string that is not exactly one token comes back unchanged.
     */
    public static String rewriteToken(String raw, String newPreviousName) {
        ParameterValue.Reference reference = ReferenceToken.parse(raw);
        if (reference == null) {
            return raw;
        }
        return ReferenceToken.format(reference.withNodeName(newPreviousName == null ? "" : newPreviousName));
    }
}
