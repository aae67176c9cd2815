package com.chaineditor.session;

/**
 * Runs a task on the next turn of the editor's cooperative scheduler, after the current task has finished.
 */
@FunctionalInterface
public interface SettleScheduler {

    void schedule(Runnable task);
}
