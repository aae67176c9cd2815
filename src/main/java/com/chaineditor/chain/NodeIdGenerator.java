package com.chaineditor.chain;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of node ids. Ids are opaque and never reused within a process.
 */
@FunctionalInterface
public interface NodeIdGenerator {

    AtomicLong SEQUENCE = new AtomicLong();

    String nextId();

    static NodeIdGenerator random() {
        return () -> "node_" + SEQUENCE.incrementAndGet() + "_"
            + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
