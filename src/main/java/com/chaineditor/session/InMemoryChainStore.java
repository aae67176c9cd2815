package com.chaineditor.session;

import com.chaineditor.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain store backed by a snapshot list. Reads and commits copy, so no caller shares nodes with the store.
 */
public class InMemoryChainStore implements ChainStore {

    private List<WorkflowNode> snapshot = new ArrayList<>();
    private long version;

    public InMemoryChainStore() {
    }

    public InMemoryChainStore(List<WorkflowNode> initial) {
        this.snapshot = copyOf(initial);
    }

    @Override
    public synchronized List<WorkflowNode> read() {
        return copyOf(snapshot);
    }

    @Override
    public synchronized void commit(List<WorkflowNode> nodes) {
        this.snapshot = copyOf(nodes);
        this.version++;
    }

    @Override
    public synchronized long version() {
        return version;
    }

    private static List<WorkflowNode> copyOf(List<WorkflowNode> nodes) {
        List<WorkflowNode> copy = new ArrayList<>();
        if (nodes != null) {
            for (WorkflowNode node : nodes) {
                copy.add(node.copy());
            }
        }
        return copy;
    }
}
