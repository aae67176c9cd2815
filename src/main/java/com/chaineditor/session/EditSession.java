package com.chaineditor.session;

import com.chaineditor.AppLogger;
import com.chaineditor.catalog.TemplateCatalog;
import com.chaineditor.chain.ConsistencyPass;
import com.chaineditor.chain.NodeIdGenerator;
import com.chaineditor.chain.SettleReport;
import com.chaineditor.chain.SubmissionMapper;
import com.chaineditor.chain.WorkflowChain;
import com.chaineditor.model.NodeTemplate;
import com.chaineditor.model.ParameterValue;
import com.chaineditor.model.SubmittedNode;
import com.chaineditor.model.WorkflowNode;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Applies user edits to the committed chain in two phases.
 *
 * Phase 1: read the store, apply the edit, commit.
 * Phase 2: a settle task scheduled for the next turn reads the store again, runs
 * {@link ConsistencyPass} on whatever is committed by then, and commits the result.
 *
 * An edit arriving while a settle is pending is applied right away; the pending settle
 * covers it, so at most one settle is queued at a time.
 */
public class EditSession {

    public enum State {
        IDLE,
        PENDING_SETTLE
    }

    private final ChainStore store;
    private final SettleScheduler scheduler;
    private final TemplateCatalog catalog;
    private final NodeIdGenerator idGenerator;
    private final AppLogger logger = AppLogger.get();

    private State state = State.IDLE;
    private long generation;
    private SettleReport lastSettle;
    private long settleCount;

    public EditSession(ChainStore store, SettleScheduler scheduler, TemplateCatalog catalog,
                       NodeIdGenerator idGenerator) {
        this.store = Objects.requireNonNull(store, "store");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.catalog = catalog;
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public EditSession(ChainStore store, SettleScheduler scheduler, TemplateCatalog catalog) {
        this(store, scheduler, catalog, NodeIdGenerator.random());
    }

    public String insert(String templateId) {
        if (catalog == null) {
            throw new IllegalStateException("No template catalog configured");
        }
        return insert(catalog.require(templateId));
    }

    public String insert(String templateId, int index) {
        if (catalog == null) {
            throw new IllegalStateException("No template catalog configured");
        }
        return insert(catalog.require(templateId), index);
    }

    public String insert(NodeTemplate template) {
        String id = edit(chain -> chain.insert(template));
        logger.info("[EditSession] Inserted node " + id + " from template " + template.getId());
        return id;
    }

    public String insert(NodeTemplate template, int index) {
        String id = edit(chain -> chain.insert(template, index));
        logger.info("[EditSession] Inserted node " + id + " from template " + template.getId() + " at " + index);
        return id;
    }

    public WorkflowNode remove(int index) {
        WorkflowNode removed = edit(chain -> chain.remove(index));
        logger.info("[EditSession] Removed node '" + removed.getName() + "' at " + index);
        return removed;
    }

    public void move(int fromIndex, int toIndex) {
        edit(chain -> {
            chain.move(fromIndex, toIndex);
            return null;
        });
        logger.info("[EditSession] Moved node " + fromIndex + " -> " + toIndex);
    }

    /**
     * Drag-and-drop move correlated by node id. Dropping a node on itself changes nothing.
     */
    public boolean moveById(String activeId, String overId) {
        boolean moved = edit(chain -> chain.moveById(activeId, overId));
        if (moved) {
            logger.info("[EditSession] Moved node " + activeId + " onto " + overId);
        }
        return moved;
    }

    public String renameField(int index, String newName) {
        String applied = edit(chain -> chain.renameField(index, newName));
        if (!Objects.equals(applied, newName)) {
            logger.info("[EditSession] Name '" + newName + "' taken, using '" + applied + "'");
        }
        return applied;
    }

    public void setParameter(int index, String key, ParameterValue value) {
        edit(chain -> {
            chain.setParameter(index, key, value);
            return null;
        });
    }

    /**
     * UI flag only; committed without a settle.
     */
    public void setMinimized(int index, boolean minimized) {
        WorkflowChain chain = new WorkflowChain(store.read(), idGenerator);
        chain.setMinimized(index, minimized);
        store.commit(chain.toList());
    }

    /**
     * Replace the chain with a saved workflow. Names are kept as saved; only linkage is derived.
     * A settle still queued for the replaced chain is discarded.
     */
    public void load(List<SubmittedNode> saved) {
        List<WorkflowNode> expanded = SubmissionMapper.expand(saved, catalog, idGenerator);
        generation++;
        state = State.IDLE;
        store.commit(expanded);
        logger.info("[EditSession] Loaded " + saved.size() + " nodes");
    }

    public List<SubmittedNode> submit() {
        return SubmissionMapper.flatten(store.read());
    }

    public List<WorkflowNode> nodes() {
        return store.read();
    }

    public State getState() {
        return state;
    }

    public SettleReport getLastSettle() {
        return lastSettle;
    }

    public long getSettleCount() {
        return settleCount;
    }

    private <T> T edit(Function<WorkflowChain, T> operation) {
        WorkflowChain chain = new WorkflowChain(store.read(), idGenerator);
        T result = operation.apply(chain);
        store.commit(chain.toList());
        requestSettle();
        return result;
    }

    private void requestSettle() {
        if (state == State.PENDING_SETTLE) {
            return;
        }
        state = State.PENDING_SETTLE;
        long scheduledFor = generation;
        scheduler.schedule(() -> settle(scheduledFor));
    }

    private void settle(long scheduledFor) {
        if (scheduledFor != generation) {
            logger.debug("[EditSession] Dropped settle for a chain replaced by load");
            return;
        }
        try {
            List<WorkflowNode> nodes = store.read();
            SettleReport report = ConsistencyPass.run(nodes);
            store.commit(nodes);
            lastSettle = report;
            settleCount++;
            if (report.hasChanges()) {
                logger.info("[EditSession] Settled chain of " + nodes.size() + " nodes: " + report);
            } else {
                logger.debug("[EditSession] Chain already consistent");
            }
        } finally {
            state = State.IDLE;
        }
    }
}
