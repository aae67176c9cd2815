package com.chaineditor.chain;

import com.chaineditor.catalog.TemplateCatalog;
import com.chaineditor.model.NodeTemplate;
import com.chaineditor.model.SubmittedNode;
import com.chaineditor.model.WorkflowNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between the editor's chain and the flat node list used for persistence and execution.
 */
public final class SubmissionMapper {

    static final String MISSING_NAME = "Missing node name";

    private SubmissionMapper() {
    }

    /**
     * Flatten to {@code {name, type, parameters, position}} with 1-based positions.
     * References stay embedded as written.
     *
     * @throws WorkflowValidationException if any node has an empty name
     */
    public static List<SubmittedNode> flatten(List<WorkflowNode> nodes) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            String name = nodes.get(i).getName();
            if (name == null || name.isBlank()) {
                errors.put("nodes[" + i + "].name", MISSING_NAME);
            }
        }
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }

        List<SubmittedNode> submitted = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            submitted.add(new SubmittedNode(node.getName(), node.getType(), node.getParameters(), i + 1));
        }
        return submitted;
    }

    /**
     * Rebuild editor nodes from a saved list: ordered by position, fresh ids, schemas restored
     * from the catalog by type, linkage recomputed. Names are kept exactly as saved.
     */
    public static List<WorkflowNode> expand(List<SubmittedNode> submitted, TemplateCatalog catalog,
                                            NodeIdGenerator idGenerator) {
        List<SubmittedNode> ordered = new ArrayList<>(submitted);
        ordered.sort(Comparator.comparingInt(SubmittedNode::getPosition));

        List<WorkflowNode> nodes = new ArrayList<>(ordered.size());
        for (SubmittedNode saved : ordered) {
            WorkflowNode node = new WorkflowNode(idGenerator.nextId(), saved.getName(), saved.getType());
            node.setParameters(saved.getParameters());
            Optional<NodeTemplate> template = catalog != null ? catalog.findByType(saved.getType()) : Optional.empty();
            if (template.isPresent()) {
                NodeTemplate t = template.get();
                node.setTemplateKey(t.getId());
                node.setInputSchema(t.getInputSchema() != null ? t.getInputSchema().deepCopy() : null);
                node.setOutputSchema(t.getOutputSchema() != null ? t.getOutputSchema().deepCopy() : null);
            }
            node.setMinimized(false);
            nodes.add(node);
        }
        ConsistencyPass.relink(nodes);
        return nodes;
    }
}
