package com.chaineditor.chain;

import com.chaineditor.TestTemplates;
import com.chaineditor.catalog.TemplateCatalog;
import com.chaineditor.model.NodeTemplate;
import com.chaineditor.model.ParameterValue;
import com.chaineditor.model.SubmittedNode;
import com.chaineditor.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionMapperTest {

    private final NodeTemplate fetch = TestTemplates.withArrayInput("fetch", "Fetch");
    private final NodeTemplate sink = TestTemplates.withArrayInput("sink", "Sink");

    private final TemplateCatalog catalog = new TemplateCatalog() {
        @Override
        public List<NodeTemplate> list() {
            return List.of(fetch, sink);
        }

        @Override
        public Optional<NodeTemplate> find(String templateId) {
            return list().stream().filter(t -> t.getId().equals(templateId)).findFirst();
        }
    };

    private List<WorkflowNode> threeNodeChain() {
        WorkflowChain chain = new WorkflowChain(List.of(), TestTemplates.sequentialIds());
        chain.insert(fetch);
        chain.insert(fetch);
        chain.insert(sink);
        chain.setMinimized(2, true);
        ConsistencyPass.run(chain);
        return chain.toList();
    }

    @Test
    void flattenUsesOneBasedPositionsAndKeepsReferences() {
        List<SubmittedNode> submitted = SubmissionMapper.flatten(threeNodeChain());

        assertEquals(3, submitted.size());
        assertEquals(1, submitted.get(0).getPosition());
        assertEquals(3, submitted.get(2).getPosition());
        assertEquals("Sink", submitted.get(2).getName());
        assertEquals("sink", submitted.get(2).getType());
        assertEquals(ParameterValue.reference("Fetch2", ".output"), submitted.get(2).getParameters().get("items"));
    }

    @Test
    void expandRestoresOrderFromPositions() {
        List<WorkflowNode> original = threeNodeChain();
        List<SubmittedNode> submitted = new ArrayList<>(SubmissionMapper.flatten(original));
        java.util.Collections.reverse(submitted);

        List<WorkflowNode> expanded = SubmissionMapper.expand(submitted, catalog, TestTemplates.sequentialIds());

        assertEquals(List.of("Fetch1", "Fetch2", "Sink"),
            List.of(expanded.get(0).getName(), expanded.get(1).getName(), expanded.get(2).getName()));
        for (int i = 0; i < original.size(); i++) {
            assertEquals(original.get(i).getParameters(), expanded.get(i).getParameters());
            assertEquals(original.get(i).getPreviousNodeName(), expanded.get(i).getPreviousNodeName());
        }
    }

    @Test
    void expandRestoresUiFieldsFromCatalog() {
        List<WorkflowNode> expanded = SubmissionMapper.expand(
            SubmissionMapper.flatten(threeNodeChain()), catalog, TestTemplates.sequentialIds());

        WorkflowNode last = expanded.get(2);
        assertEquals("sink", last.getTemplateKey());
        assertEquals(sink.getInputSchema(), last.getInputSchema());
        assertFalse(last.isMinimized());
        assertNotNull(last.getId());
    }

    @Test
    void expandWithoutMatchingTemplateKeepsNode() {
        SubmittedNode unknown = new SubmittedNode("Custom", "custom_step", null, 1);

        List<WorkflowNode> expanded = SubmissionMapper.expand(List.of(unknown), catalog, TestTemplates.sequentialIds());

        assertEquals("Custom", expanded.get(0).getName());
        assertNull(expanded.get(0).getTemplateKey());
        assertNull(expanded.get(0).getInputSchema());
    }

    @Test
    void emptyNamesAreReportedPerField() {
        List<WorkflowNode> nodes = threeNodeChain();
        nodes.get(0).setName("");
        nodes.get(2).setName("  ");

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
            () -> SubmissionMapper.flatten(nodes));

        assertEquals(2, e.getFieldErrors().size());
        assertEquals("Missing node name", e.getFieldErrors().get("nodes[0].name"));
        assertTrue(e.getFieldErrors().containsKey("nodes[2].name"));
    }
}
