package com.chaineditor.session;

import com.chaineditor.AppLogger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * FIFO of deferred tasks drained explicitly by the owner with {@link #runPending()}.
 * Tasks scheduled while draining run in the same drain, after the ones already queued.
 */
public class DeferredTaskQueue implements SettleScheduler {

    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private final AppLogger logger = AppLogger.get();

    @Override
    public synchronized void schedule(Runnable task) {
        tasks.addLast(task);
    }

    public synchronized int pendingCount() {
        return tasks.size();
    }

    /**
     * Run queued tasks until the queue is empty. Returns the number of tasks run.
     */
    public int runPending() {
        int ran = 0;
        Runnable next;
        while ((next = poll()) != null) {
            try {
                next.run();
            } catch (RuntimeException e) {
                logger.error("[DeferredTaskQueue] Deferred task failed: " + e.getMessage(), e);
            }
            ran++;
        }
        return ran;
    }

    private synchronized Runnable poll() {
        return tasks.pollFirst();
    }
}
