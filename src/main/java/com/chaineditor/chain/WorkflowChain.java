package com.chaineditor.chain;

import com.chaineditor.model.NodeTemplate;
import com.chaineditor.model.ParameterValue;
import com.chaineditor.model.WorkflowNode;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The ordered node list and its structural edits.
 *
 * Edits do not restore linkage or references on their own; {@link ConsistencyPass}
 * runs after each of them. Every edit validates its indices first and leaves the
 * chain untouched when it throws.
 */
public class WorkflowChain {

    static final String DEFAULT_OUTPUT_PATH = ".output";

    private final List<WorkflowNode> nodes;
    private final NodeIdGenerator idGenerator;

    public WorkflowChain(List<WorkflowNode> nodes, NodeIdGenerator idGenerator) {
        this.nodes = new ArrayList<>();
        if (nodes != null) {
            for (WorkflowNode node : nodes) {
                this.nodes.add(node.copy());
            }
        }
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public WorkflowNode get(int index) {
        checkIndex(index);
        return nodes.get(index).copy();
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(nodes.size());
        for (WorkflowNode node : nodes) {
            names.add(node.getName());
        }
        return names;
    }

    public int indexOfId(String id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (Objects.equals(nodes.get(i).getId(), id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Deep copy of the nodes in chain order.
     */
    public List<WorkflowNode> toList() {
        List<WorkflowNode> copy = new ArrayList<>(nodes.size());
        for (WorkflowNode node : nodes) {
            copy.add(node.copy());
        }
        return copy;
    }

    List<WorkflowNode> nodes() {
        return nodes;
    }

    public String insert(NodeTemplate template) {
        return insert(template, nodes.size());
    }

    /**
     * Create a node from {@code template} at {@code index} and return its id.
     * Array-typed inputs are wired to the output of the node before it.
     */
    public String insert(NodeTemplate template, int index) {
        Objects.requireNonNull(template, "template");
        if (index < 0 || index > nodes.size()) {
            throw new ChainEditException("Insert position out of range: " + index + " (size " + nodes.size() + ")");
        }
        String previousNodeName = index > 0 ? nameOrEmpty(nodes.get(index - 1)) : "";
        String baseName = template.getName() != null ? template.getName() : template.getType();
        String name = NameAllocator.generateUniqueName(baseName, names());

        Map<String, ParameterValue> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : template.getDefaultParameters().entrySet()) {
            parameters.put(entry.getKey(), ParameterValue.literal(entry.getValue()));
        }
        if (!previousNodeName.isEmpty()) {
            for (String key : template.getArrayParameterKeys()) {
                parameters.put(key, ParameterValue.reference(previousNodeName, DEFAULT_OUTPUT_PATH));
            }
        }

        WorkflowNode node = new WorkflowNode(idGenerator.nextId(), name, template.getType());
        node.setTemplateKey(template.getId());
        node.setParameters(parameters);
        node.setInputSchema(template.getInputSchema() != null ? template.getInputSchema().deepCopy() : null);
        node.setOutputSchema(template.getOutputSchema() != null ? template.getOutputSchema().deepCopy() : null);
        node.setPreviousNodeName(previousNodeName);
        node.setMinimized(false);
        nodes.add(index, node);
        return node.getId();
    }

    public void move(int fromIndex, int toIndex) {
        checkIndex(fromIndex);
        checkIndex(toIndex);
        if (fromIndex == toIndex) {
            return;
        }
        WorkflowNode node = nodes.remove(fromIndex);
        nodes.add(toIndex, node);
    }

    /**
     * Move the node with {@code activeId} to the slot held by {@code overId}, as a drag gesture reports it.
     * Returns false when both ids name the same node.
     */
    public boolean moveById(String activeId, String overId) {
        int from = indexOfId(activeId);
        int to = indexOfId(overId);
        if (from < 0) {
            throw new ChainEditException("Unknown node id: " + activeId);
        }
        if (to < 0) {
            throw new ChainEditException("Unknown node id: " + overId);
        }
        if (from == to) {
            return false;
        }
        move(from, to);
        return true;
    }

    /**
     * Remove the node at {@code index}. Nodes that referenced it are left as they are.
     */
    public WorkflowNode remove(int index) {
        checkIndex(index);
        return nodes.remove(index);
    }

    /**
     * Direct rename. A name already used by another node is replaced with the next free
     * variant; an empty name is stored as given. Returns the name actually applied.
     */
    public String renameField(int index, String newName) {
        checkIndex(index);
        String applied = newName == null ? "" : newName;
        if (!applied.isEmpty()) {
            List<String> current = names();
            boolean duplicate = false;
            for (int i = 0; i < current.size(); i++) {
                if (i != index && applied.equals(current.get(i))) {
                    duplicate = true;
                    break;
                }
            }
            if (duplicate) {
                applied = NameAllocator.generateUniqueName(applied, current, index);
            }
        }
        nodes.get(index).setName(applied);
        return applied;
    }

    public void setMinimized(int index, boolean minimized) {
        checkIndex(index);
        nodes.get(index).setMinimized(minimized);
    }

    public void setParameter(int index, String key, ParameterValue value) {
        checkIndex(index);
        if (key == null || key.isBlank()) {
            throw new ChainEditException("Parameter key required");
        }
        nodes.get(index).getParameters().put(key, value);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new ChainEditException("Node index out of range: " + index + " (size " + nodes.size() + ")");
        }
    }

    static String nameOrEmpty(WorkflowNode node) {
        return node.getName() == null ? "" : node.getName();
    }
}
