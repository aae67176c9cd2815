package com.chaineditor.session;

import com.chaineditor.model.WorkflowNode;

import java.util.List;

/**
 * Externally owned holder of the committed chain. A commit is visible to every read issued after it returns.
 */
public interface ChainStore {

    List<WorkflowNode> read();

    void commit(List<WorkflowNode> nodes);

    /**
     * Incremented on every commit.
     */
    long version();
}
