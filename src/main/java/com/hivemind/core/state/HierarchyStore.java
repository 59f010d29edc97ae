package com.hivemind.core.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owner of the shared {@link HierarchyState}.
 * <p>
 * Every read-modify-write goes through {@link #mutate}: mutations are queued to a single
 * writer thread and applied one at a time against a working copy, which is then committed
 * to the {@link StateRepository} with a version check. When another process committed first
 * the store reloads, re-applies the mutation and retries with exponential backoff, up to
 * {@code conflictRetries} times, after which {@link StateConflictException} is thrown.
 * A mutation that throws leaves the state untouched.
 * <p>
 * Mutation functions must be free of outside side effects (they may run more than once)
 * and must return values that do not alias the working copy.
 */
public class HierarchyStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HierarchyStore.class);

    private final StateRepository repository;
    private final StateMapper mapper;
    private final Clock clock;
    private final int conflictRetries;
    private final long conflictBackoffMs;
    private final ExecutorService writer;
    private final ThreadLocal<Boolean> onWriterThread = ThreadLocal.withInitial(() -> Boolean.FALSE);

    /** Last committed state; only touched on the writer thread. */
    private HierarchyState state;

    public HierarchyStore(StateRepository repository, StateMapper mapper, Clock clock,
                          int conflictRetries, long conflictBackoffMs) {
        this.repository = repository;
        this.mapper = mapper;
        this.clock = clock;
        this.conflictRetries = Math.max(0, conflictRetries);
        this.conflictBackoffMs = Math.max(0, conflictBackoffMs);
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hivemind-store-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Applies {@code mutation} atomically and returns its result.
     *
     * @param operation short name used in logs
     * @throws IntegrityException      if the mutation references missing nodes
     * @throws StateConflictException  if the commit kept conflicting past the retry cap
     */
    public <T> T mutate(String operation, Function<HierarchyState, T> mutation) {
        if (onWriterThread.get()) {
            throw new IllegalStateException("Nested mutation '" + operation + "' inside another mutation");
        }
        return submit(() -> applyWithRetry(operation, mutation));
    }

    /**
     * Runs {@code query} against a private copy of the latest committed state.
     */
    public <T> T read(Function<HierarchyState, T> query) {
        if (onWriterThread.get()) {
            refreshIfStale();
            return query.apply(mapper.copy(state));
        }
        return submit(() -> {
            refreshIfStale();
            return query.apply(mapper.copy(state));
        });
    }

    public Clock clock() {
        return clock;
    }

    private <T> T applyWithRetry(String operation, Function<HierarchyState, T> mutation) {
        ConcurrentUpdateException lastConflict = null;
        for (int attempt = 0; attempt <= conflictRetries; attempt++) {
            refreshIfStale();
            HierarchyState working = mapper.copy(state);
            T result = mutation.apply(working);
            working.setUpdatedAt(clock.instant());
            try {
                long version = repository.save(working, state.getVersion());
                working.setVersion(version);
                state = working;
                log.debug("Mutation '{}' committed at version {}", operation, version);
                return result;
            } catch (ConcurrentUpdateException e) {
                lastConflict = e;
                log.info("Mutation '{}' conflicted (attempt {}/{}): {}",
                        operation, attempt + 1, conflictRetries + 1, e.getMessage());
                state = repository.load();
                if (attempt < conflictRetries) {
                    backoff(attempt);
                }
            }
        }
        throw new StateConflictException("Mutation '" + operation + "' gave up after "
                + (conflictRetries + 1) + " conflicting attempts", lastConflict);
    }

    private void refreshIfStale() {
        if (state == null || repository.currentVersion() != state.getVersion()) {
            state = repository.load();
        }
    }

    private void backoff(int attempt) {
        long delay = conflictBackoffMs * (1L << Math.min(attempt, 10));
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateConflictException("Interrupted while backing off after a conflict", e);
        }
    }

    private <T> T submit(Callable<T> task) {
        Future<T> future = writer.submit(() -> {
            onWriterThread.set(Boolean.TRUE);
            try {
                return task.call();
            } finally {
                onWriterThread.set(Boolean.FALSE);
            }
        });
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HivemindException("Interrupted while waiting for the store writer", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new HivemindException("Store operation failed", cause);
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
