package io.meshbroker.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every {@link BrokerStore} call on one dedicated thread, in submission order.
 *
 * <p>Connection threads only submit; retries and backoff sleeps happen here. Dependent
 * stages attached to a returned future run on this thread before the next call starts,
 * so a read submitted after a write always observes it.
 */
public final class StoreLane implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreLane.class);
    private static final AtomicInteger SEQ = new AtomicInteger();

    private final BrokerStore store;
    private final ExecutorService executor;

    public StoreLane(BrokerStore store) {
        this.store = store;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "meshbroker-store-" + SEQ.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @FunctionalInterface
    public interface StoreCall<T> {
        T apply(BrokerStore store);
    }

    public <T> CompletableFuture<T> submit(StoreCall<T> call) {
        try {
            return CompletableFuture.supplyAsync(() -> call.apply(store), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StoreException("store lane is closed", e));
        }
    }

    /**
     * Submits and waits. Store failures are rethrown as {@link StoreException}.
     */
    public <T> T call(StoreCall<T> call) {
        try {
            return submit(call).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new StoreException("store call failed", e.getCause());
        }
    }

    /**
     * The failure behind a {@link CompletionException}, as seen by dependent stages.
     */
    public static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Waits until everything submitted so far has run.
     */
    public boolean flush(long timeoutMs) {
        try {
            submit(store -> null).get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (Exception e) {
            log.debug("Store lane flush did not complete: {}", e.toString());
            return false;
        }
    }

    /**
     * Stops accepting calls and lets pending writes finish for up to {@code timeoutMs}.
     */
    public void close(long timeoutMs) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Store lane still busy after {}ms, abandoning pending writes", timeoutMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        close(10_000L);
    }
}
