package net.luminalib.support.ai;

import jakarta.annotation.PreDestroy;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import net.luminalib.config.IntelligenceProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Global in-memory queue for background generation work.
 *
 * <p>Tasks run on daemon threads with bounded parallelism so request threads never wait
 * on a model. Higher priorities drain first; equal priorities keep FIFO order. When the
 * pending backlog reaches its cap new work is rejected instead of growing without bound.</p>
 */
@Service
public class IntelligenceWorkQueue {

    private static final int MAX_ALLOWED_PARALLEL = 20;

    private final ExecutorService executorService;
    private final TreeMap<Integer, Deque<QueuedTask<?>>> pendingByPriority;
    private final int maxParallel;
    private final int maxPending;

    private int pendingCount;
    private int runningCount;

    @Autowired
    public IntelligenceWorkQueue(IntelligenceProperties properties) {
        this(properties.getMaxParallel(), properties.getMaxPending());
    }

    public IntelligenceWorkQueue(int configuredParallelism, int maxPending) {
        this.maxParallel = coerceParallelism(configuredParallelism);
        this.maxPending = Math.max(1, maxPending);
        this.pendingByPriority = new TreeMap<>(Comparator.reverseOrder());
        this.executorService = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("intelligence-worker-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Returns queue depth and concurrency metrics.
     */
    public synchronized QueueSnapshot snapshot() {
        return new QueueSnapshot(runningCount, pendingCount, maxParallel, maxPending);
    }

    /**
     * Enqueues a task for execution.
     *
     * @param priority higher values run earlier
     * @param supplier task execution callback
     * @return future completed with the task's result or failure
     * @throws IntelligenceQueueCapacityExceededException when the pending cap is reached
     */
    public synchronized <T> CompletableFuture<T> enqueue(int priority, Supplier<T> supplier) {
        if (pendingCount >= maxPending) {
            throw new IntelligenceQueueCapacityExceededException(maxPending, pendingCount);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        pendingByPriority.computeIfAbsent(priority, key -> new ArrayDeque<>())
            .addLast(new QueuedTask<>(supplier, result));
        pendingCount += 1;

        drain();
        return result;
    }

    @PreDestroy
    void shutdown() {
        executorService.shutdownNow();
    }

    private synchronized void drain() {
        while (runningCount < maxParallel) {
            QueuedTask<?> next = shiftNext();
            if (next == null) {
                return;
            }
            runningCount += 1;
            executorService.submit(() -> executeTask(next));
        }
    }

    private synchronized QueuedTask<?> shiftNext() {
        Iterator<Map.Entry<Integer, Deque<QueuedTask<?>>>> iterator = pendingByPriority.entrySet().iterator();
        while (iterator.hasNext()) {
            Deque<QueuedTask<?>> queue = iterator.next().getValue();
            QueuedTask<?> next = queue.pollFirst();
            if (queue.isEmpty()) {
                iterator.remove();
            }
            if (next != null) {
                pendingCount -= 1;
                return next;
            }
        }
        return null;
    }

    private <T> void executeTask(QueuedTask<T> task) {
        try {
            task.result.complete(task.supplier.get());
        } catch (RuntimeException | Error failure) {
            task.result.completeExceptionally(failure);
        } finally {
            synchronized (this) {
                runningCount -= 1;
                drain();
            }
        }
    }

    private static int coerceParallelism(int configuredParallelism) {
        if (configuredParallelism <= 0) {
            return 1;
        }
        return Math.min(configuredParallelism, MAX_ALLOWED_PARALLEL);
    }

    private record QueuedTask<T>(Supplier<T> supplier, CompletableFuture<T> result) {
    }

    public record QueueSnapshot(int running, int pending, int maxParallel, int maxPending) {
    }
}
