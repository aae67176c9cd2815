package com.chaineditor.session;

import com.chaineditor.TestTemplates;
import com.chaineditor.catalog.TemplateCatalog;
import com.chaineditor.catalog.UnknownTemplateException;
import com.chaineditor.chain.ChainEditException;
import com.chaineditor.chain.WorkflowValidationException;
import com.chaineditor.model.NodeTemplate;
import com.chaineditor.model.ParameterValue;
import com.chaineditor.model.SubmittedNode;
import com.chaineditor.model.WorkflowNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EditSessionTest {

    private final NodeTemplate fetch = TestTemplates.withArrayInput("fetch", "Fetch");
    private final NodeTemplate load = TestTemplates.withArrayInput("load", "Load");

    private final TemplateCatalog catalog = new TemplateCatalog() {
        @Override
        public List<NodeTemplate> list() {
            return List.of(fetch, load);
        }

        @Override
        public Optional<NodeTemplate> find(String templateId) {
            return list().stream().filter(t -> t.getId().equals(templateId)).findFirst();
        }
    };

    private InMemoryChainStore store;
    private DeferredTaskQueue queue;
    private EditSession session;

    @BeforeEach
    void setUp() {
        store = new InMemoryChainStore();
        queue = new DeferredTaskQueue();
        session = new EditSession(store, queue, catalog, TestTemplates.sequentialIds());
    }

    private List<String> names() {
        List<String> names = new ArrayList<>();
        for (WorkflowNode node : session.nodes()) {
            names.add(node.getName());
        }
        return names;
    }

    @Test
    void editCommitsImmediatelyAndSettlesOnNextTurn() {
        session.insert("fetch");
        session.insert("fetch");

        assertEquals(EditSession.State.PENDING_SETTLE, session.getState());
        assertEquals(List.of("Fetch", "Fetch1"), names());
        assertEquals("Fetch", session.nodes().get(1).getPreviousNodeName());

        queue.runPending();

        assertEquals(EditSession.State.IDLE, session.getState());
        assertEquals(List.of("Fetch1", "Fetch2"), names());
        assertEquals("Fetch1", session.nodes().get(1).getPreviousNodeName());
        assertEquals(ParameterValue.reference("Fetch1", ".output"),
            session.nodes().get(1).getParameters().get("items"));
    }

    @Test
    void editsWhilePendingShareOneSettle() {
        session.insert("fetch");
        session.insert("load");
        session.move(1, 0);

        assertEquals(1, queue.pendingCount());
        assertEquals(1, queue.runPending());
        assertEquals(1, session.getSettleCount());

        List<WorkflowNode> nodes = session.nodes();
        assertEquals(List.of("Load", "Fetch"), names());
        assertEquals("", nodes.get(0).getPreviousNodeName());
        assertEquals("Load", nodes.get(1).getPreviousNodeName());
    }

    @Test
    void settleSeesEditsCommittedAfterScheduling() {
        session.insert("load");
        long versionBefore = store.version();
        session.insert("load");
        assertTrue(store.version() > versionBefore);

        queue.runPending();

        assertEquals(List.of("Load1", "Load2"), names());
    }

    @Test
    void removingDuplicateCollapsesNameBack() {
        session.insert("load");
        session.insert("load");
        queue.runPending();
        assertEquals(List.of("Load1", "Load2"), names());

        session.remove(1);
        queue.runPending();

        assertEquals(List.of("Load"), names());
    }

    @Test
    void insertInsertMoveScenario() {
        String firstId = session.insert("fetch");
        queue.runPending();
        assertEquals(List.of("Fetch"), names());

        String secondId = session.insert("fetch");
        assertEquals("Fetch1", session.nodes().get(1).getName());
        assertEquals("Fetch", session.nodes().get(1).getPreviousNodeName());
        queue.runPending();

        session.move(1, 0);
        queue.runPending();

        List<WorkflowNode> nodes = session.nodes();
        assertEquals(secondId, nodes.get(0).getId());
        assertEquals(firstId, nodes.get(1).getId());
        assertEquals("", nodes.get(0).getPreviousNodeName());
        assertEquals(List.of("Fetch1", "Fetch2"), names());
        assertEquals(nodes.get(0).getName(), nodes.get(1).getPreviousNodeName());
        assertEquals(ParameterValue.reference("", ".output"), nodes.get(0).getParameters().get("items"));
        assertFalse(nodes.get(1).getParameters().containsKey("items"));
    }

    @Test
    void renameCollisionIsResolvedSilently() {
        session.insert("fetch");
        session.insert("load");
        queue.runPending();

        String applied = session.renameField(1, "Fetch");
        assertEquals("Fetch1", applied);
        queue.runPending();

        assertEquals(List.of("Fetch1", "Fetch2"), names());
        assertEquals(ParameterValue.reference("Fetch1", ".output"), session.nodes().get(1).getParameters().get("items"));
    }

    @Test
    void renamePropagatesToImmediateSuccessor() {
        session.insert("fetch");
        session.insert("load");
        queue.runPending();

        session.renameField(0, "Source");
        queue.runPending();

        assertEquals(ParameterValue.reference("Source", ".output"), session.nodes().get(1).getParameters().get("items"));
    }

    @Test
    void failedEditCommitsNothing() {
        session.insert("fetch");
        queue.runPending();
        long version = store.version();

        assertThrows(ChainEditException.class, () -> session.remove(4));
        assertThrows(UnknownTemplateException.class, () -> session.insert("missing"));

        assertEquals(version, store.version());
        assertEquals(EditSession.State.IDLE, session.getState());
    }

    @Test
    void minimizeDoesNotScheduleSettle() {
        session.insert("fetch");
        queue.runPending();

        session.setMinimized(0, true);

        assertEquals(EditSession.State.IDLE, session.getState());
        assertEquals(0, queue.pendingCount());
        assertTrue(session.nodes().get(0).isMinimized());
    }

    @Test
    void userTypedReferenceIsPointedAtPredecessor() {
        session.insert("fetch");
        session.insert("load");
        queue.runPending();

        session.setParameter(1, "extra", ParameterValue.reference("Somewhere", ".rows"));
        queue.runPending();

        assertEquals(ParameterValue.reference("Fetch", ".rows"), session.nodes().get(1).getParameters().get("extra"));
    }

    @Test
    void submitRejectsEmptyName() {
        session.insert("fetch");
        session.renameField(0, "");
        queue.runPending();

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class, () -> session.submit());
        assertTrue(e.getFieldErrors().containsKey("nodes[0].name"));
    }

    @Test
    void loadKeepsSavedNamesAndDerivesLinkage() {
        List<SubmittedNode> saved = List.of(
            new SubmittedNode("Load2", "load", null, 2),
            new SubmittedNode("Fetch", "fetch", null, 1));

        session.load(saved);

        assertEquals(List.of("Fetch", "Load2"), names());
        assertEquals("Fetch", session.nodes().get(1).getPreviousNodeName());
        assertEquals("load", session.nodes().get(1).getTemplateKey());
        assertEquals(0, queue.pendingCount());
    }

    @Test
    void loadDiscardsSettlePendingForReplacedChain() {
        session.insert("fetch");
        assertEquals(EditSession.State.PENDING_SETTLE, session.getState());

        session.load(List.of(
            new SubmittedNode("Load7", "load", null, 1),
            new SubmittedNode("Sink", "fetch", Map.of("items", ParameterValue.reference("Load7", ".output")), 2)));
        assertEquals(EditSession.State.IDLE, session.getState());
        queue.runPending();

        assertEquals(List.of("Load7", "Sink"), names());
        assertEquals(ParameterValue.reference("Load7", ".output"), session.nodes().get(1).getParameters().get("items"));
        assertEquals(0, session.getSettleCount());
    }

    @Test
    void editAfterLoadStillSettles() {
        session.insert("fetch");
        session.load(List.of(new SubmittedNode("Load7", "load", null, 1)));

        session.insert("load");
        assertEquals(2, queue.pendingCount());
        queue.runPending();

        assertEquals(1, session.getSettleCount());
        assertEquals(List.of("Load1", "Load2"), names());
        assertEquals(EditSession.State.IDLE, session.getState());
    }
}
