package com.chaineditor.chain;

import com.chaineditor.model.WorkflowNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full-chain sweep that restores the chain invariants after an edit.
 *
 * Order:
 *   1. linkage    - previousNodeName = name of the node before, "" for the first
 *   2. references - every reference names the node's previousNodeName
 *   3. naming     - a root used once loses its digit suffix; a shared root is numbered 1..N in chain order,
 *                   touching only names whose number differs from their position
 *   4. when step 3 renamed anything, steps 1 and 2 run again
 *
 * Renames are only ever propagated through the predecessor rewrite of step 2.
 * Running the pass on its own output changes nothing.
 */
public final class ConsistencyPass {

    private ConsistencyPass() {
    }

    public static SettleReport run(WorkflowChain chain) {
        return run(chain.nodes());
    }

    /**
     * Normalize {@code nodes} in place.
     */
    public static SettleReport run(List<WorkflowNode> nodes) {
        int links = relink(nodes);
        int references = rewriteReferences(nodes);
        int renames = normalizeNames(nodes);
        if (renames > 0) {
            links += relink(nodes);
            references += rewriteReferences(nodes);
        }
        return new SettleReport(renames, links, references);
    }

    /**
     * Linkage pass. Returns the number of nodes whose previousNodeName changed.
     */
    public static int relink(List<WorkflowNode> nodes) {
        int changed = 0;
        for (int i = 0; i < nodes.size(); i++) {
            String expected = i == 0 ? "" : WorkflowChain.nameOrEmpty(nodes.get(i - 1));
            WorkflowNode node = nodes.get(i);
            if (!expected.equals(node.getPreviousNodeName())) {
                node.setPreviousNodeName(expected);
                changed++;
            }
        }
        return changed;
    }

    /**
     * Reference pass. Returns the number of references that were repointed.
     */
    static int rewriteReferences(List<WorkflowNode> nodes) {
        int rewritten = 0;
        for (WorkflowNode node : nodes) {
            int stale = ReferenceRewriter.countStale(node.getParameters(), node.getPreviousNodeName());
            if (stale > 0) {
                node.setParameters(ReferenceRewriter.rewriteReferences(node.getParameters(), node.getPreviousNodeName()));
                rewritten += stale;
            }
        }
        return rewritten;
    }

    /**
     * Naming pass plus uniqueness guard. Returns the number of renamed nodes.
     */
    static int normalizeNames(List<WorkflowNode> nodes) {
        Map<String, Integer> rootCounts = new HashMap<>();
        for (WorkflowNode node : nodes) {
            String root = managedRoot(node);
            if (root != null) {
                rootCounts.merge(root, 1, Integer::sum);
            }
        }

        int renamed = 0;
        Map<String, Integer> sequence = new HashMap<>();
        for (WorkflowNode node : nodes) {
            String root = managedRoot(node);
            if (root == null) {
                continue;
            }
            BigInteger current = NameAllocator.rootOf(node.getName()).getNumber();
            if (rootCounts.get(root) > 1) {
                int position = sequence.merge(root, 1, Integer::sum);
                // "Load01" already holds position 1
                if (!BigInteger.valueOf(position).equals(current)) {
                    node.setName(root + position);
                    renamed++;
                }
            } else if (current != null) {
                node.setName(root);
                renamed++;
            }
        }

        return renamed + dedupe(nodes);
    }

    /**
     * Only digit-only names can still collide here; later duplicates get the next free name.
     */
    private static int dedupe(List<WorkflowNode> nodes) {
        int renamed = 0;
        Set<String> seen = new HashSet<>();
        for (WorkflowNode node : nodes) {
            String name = WorkflowChain.nameOrEmpty(node);
            if (name.isEmpty()) {
                continue;
            }
            if (!seen.add(name)) {
                List<String> taken = new ArrayList<>(nodes.size());
                for (WorkflowNode other : nodes) {
                    taken.add(other.getName());
                }
                String unique = NameAllocator.generateUniqueName(name, taken);
                node.setName(unique);
                seen.add(unique);
                renamed++;
            }
        }
        return renamed;
    }

    /**
     * Root that the naming pass manages, or null for empty and digit-only names.
     */
    private static String managedRoot(WorkflowNode node) {
        String name = WorkflowChain.nameOrEmpty(node);
        if (name.isEmpty()) {
            return null;
        }
        String root = NameAllocator.rootOf(name).getRoot();
        return root.isEmpty() ? null : root;
    }
}
