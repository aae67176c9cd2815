package com.chaineditor.catalog;

import com.chaineditor.model.NodeTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Source of node templates. The editor only reads from it, and only when inserting or re-opening nodes.
 */
public interface TemplateCatalog {

    List<NodeTemplate> list();

    Optional<NodeTemplate> find(String templateId);

    default Optional<NodeTemplate> findByType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (NodeTemplate template : list()) {
            if (type.equals(template.getType())) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    /**
     * Template lookup that fails loudly, for edits that name a template explicitly.
     */
    default NodeTemplate require(String templateId) {
        return find(templateId).orElseThrow(() -> new UnknownTemplateException(templateId));
    }
}
