package com.chaineditor.session;

import com.chaineditor.AppLogger;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded loop that owns every chain mutation of an editor instance.
 * Request threads hand work over with {@link #call(Callable)}; settle tasks are queued
 * behind whatever task is running when they are scheduled.
 */
public class EditorEventLoop implements SettleScheduler, AutoCloseable {

    private static final String THREAD_NAME = "chain-editor-loop";

    private final ExecutorService executor;
    private final AppLogger logger = AppLogger.get();
    private volatile Thread loopThread;

    public EditorEventLoop() {
        this.executor = Executors.newSingleThreadExecutor(loopThreadFactory());
    }

    @Override
    public void schedule(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("[EditorEventLoop] Deferred task failed: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Run {@code work} on the loop and wait for its result. Runtime exceptions thrown by the
     * work are rethrown unchanged on the calling thread.
     */
    public <T> T call(Callable<T> work) {
        if (Thread.currentThread() == loopThread) {
            try {
                return work.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }
        Future<T> future = executor.submit(work);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for editor loop", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause != null ? cause.getMessage() : e.getMessage(), cause);
        }
    }

    public void run(Runnable work) {
        call(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Wait until every task queued before this call has run.
     */
    public void flush() {
        run(() -> { });
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory loopThreadFactory() {
        return r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            loopThread = t;
            return t;
        };
    }
}
