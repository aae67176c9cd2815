package com.chaineditor.chain;

/**
 * What one consistency pass changed.
 */
public class SettleReport {

    private final int renamedNodes;
    private final int relinkedNodes;
    private final int rewrittenReferences;

    public SettleReport(int renamedNodes, int relinkedNodes, int rewrittenReferences) {
        this.renamedNodes = renamedNodes;
        this.relinkedNodes = relinkedNodes;
        this.rewrittenReferences = rewrittenReferences;
    }

    public int getRenamedNodes() {
        return renamedNodes;
    }

    public int getRelinkedNodes() {
        return relinkedNodes;
    }

    public int getRewrittenReferences() {
        return rewrittenReferences;
    }

    public boolean hasChanges() {
        return renamedNodes > 0 || relinkedNodes > 0 || rewrittenReferences > 0;
    }

    @Override
    public String toString() {
        return "renamed=" + renamedNodes + ", relinked=" + relinkedNodes + ", references=" + rewrittenReferences;
    }
}
