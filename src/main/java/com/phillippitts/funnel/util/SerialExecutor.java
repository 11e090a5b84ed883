package com.phillippitts.funnel.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared backing executor.
 *
 * <p>Each relay session owns one instance; every mutation of that session's state is a task
 * on it, so the session is only ever touched by one thread at a time and tasks of different
 * sessions run in parallel on the pool.
 *
 * <p>Tasks run with the given MDC context (e.g. {@code sessionId}) installed; the worker's
 * previous context is restored afterwards. A failing task is logged and does not stop the
 * tasks queued behind it.
 *
 * @since 1.0
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Executor backing;
    private final Map<String, String> context;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private Runnable active;
    private boolean shutdown;

    public SerialExecutor(Executor backing, Map<String, String> context) {
        this.backing = Objects.requireNonNull(backing, "backing");
        this.context = Map.copyOf(context);
    }

    @Override
    public void execute(Runnable command) {
        Objects.requireNonNull(command, "command");
        Runnable next = null;
        synchronized (this) {
            if (shutdown) {
                throw new RejectedExecutionException("Serial executor is shut down");
            }
            tasks.add(() -> runWithContext(command));
            if (active == null) {
                next = active = tasks.poll();
            }
        }
        dispatch(next);
    }

    /** Runs {@code supplier} on this executor and completes the returned future with its result. */
    public <T> CompletableFuture<T> submit(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, this);
    }

    /**
     * Stops accepting new tasks. Tasks already queued still run.
     */
    public synchronized void shutdown() {
        shutdown = true;
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    public synchronized int pendingTasks() {
        return tasks.size();
    }

    /** Must be called without holding the monitor; the backing executor may run the task inline. */
    private void dispatch(Runnable task) {
        if (task == null) {
            return;
        }
        try {
            backing.execute(() -> {
                try {
                    task.run();
                } finally {
                    dispatch(pollNext());
                }
            });
        } catch (RejectedExecutionException e) {
            int dropped;
            synchronized (this) {
                dropped = tasks.size() + 1;
                tasks.clear();
                active = null;
            }
            LOG.error("Backing executor rejected a serial task; {} tasks dropped", dropped, e);
        }
    }

    private synchronized Runnable pollNext() {
        active = tasks.poll();
        return active;
    }

    private void runWithContext(Runnable command) {
        Map<String, String> previous = ThreadContext.getImmutableContext();
        ThreadContext.putAll(context);
        try {
            command.run();
        } catch (RuntimeException e) {
            LOG.error("Serial task failed", e);
        } finally {
            ThreadContext.clearMap();
            if (previous != null && !previous.isEmpty()) {
                ThreadContext.putAll(previous);
            }
        }
    }
}
