package dev.ossaudit.exec;

import dev.ossaudit.AuditException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs one task per item with at most {@code limit} tasks in flight. Results come back in submission order, whatever
 * order the tasks finish in.
 *
 * <p>Failure is fail-fast: the first task failure stops admission of queued items and is rethrown. Tasks already
 * running are left to finish; nothing is cancelled or interrupted.
 */
public class BoundedTaskScheduler {
    private static final Logger logger = LogManager.getLogger(BoundedTaskScheduler.class);

    public static final int DEFAULT_CONCURRENCY = 10;

    private static final AtomicInteger poolCounter = new AtomicInteger();

    @FunctionalInterface
    public interface Task<T, R> {
        R run(T item) throws AuditException;
    }

    private record Slot<R>(int index, R value) {}

    private final int limit;

    public BoundedTaskScheduler() {
        this(DEFAULT_CONCURRENCY);
    }

    public BoundedTaskScheduler(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("concurrency limit must be at least 1, was " + limit);
        }
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }

    public <T, R> List<R> runAll(List<T> items, Task<T, R> task) throws AuditException, InterruptedException {
        if (items.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(limit, items.size());
        int poolId = poolCounter.incrementAndGet();
        var threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            var t = new Thread(r, "oss-audit-worker-" + poolId + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<Slot<R>> completionService = new ExecutorCompletionService<>(executor);

        // pre-sized so completion order never affects result order
        Object[] slots = new Object[items.size()];
        int next = 0;
        int inFlight = 0;
        try {
            while (next < workers) {
                submit(completionService, items, next++, task);
                inFlight++;
            }

            while (inFlight > 0) {
                var done = completionService.take();
                inFlight--;
                Slot<R> slot;
                try {
                    slot = done.get();
                } catch (ExecutionException e) {
                    logger.debug("Task failed; {} queued item(s) will not be started", items.size() - next);
                    throw unwrap(e);
                }
                slots[slot.index()] = slot.value();

                if (next < items.size()) {
                    submit(completionService, items, next++, task);
                    inFlight++;
                }
            }
        } finally {
            // no interrupt: in-flight tasks run to completion
            executor.shutdown();
        }

        var results = new ArrayList<R>(slots.length);
        for (Object value : slots) {
            @SuppressWarnings("unchecked")
            R result = (R) value;
            results.add(result);
        }
        return Collections.unmodifiableList(results);
    }

    private static <T, R> void submit(
            CompletionService<Slot<R>> completionService, List<T> items, int index, Task<T, R> task) {
        var item = items.get(index);
        completionService.submit(() -> new Slot<>(index, task.run(item)));
    }

    private static AuditException unwrap(ExecutionException e) {
        var cause = e.getCause();
        if (cause instanceof AuditException auditException) {
            return auditException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unexpected task failure", cause);
    }
}
