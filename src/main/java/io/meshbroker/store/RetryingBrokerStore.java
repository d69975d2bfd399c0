package io.meshbroker.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Retries each store call up to {@code maxAttempts} times with a linear backoff
 * of {@code retryDelayMs * attempt}. The last failure is rethrown.
 */
public final class RetryingBrokerStore implements BrokerStore {
    private static final Logger log = LoggerFactory.getLogger(RetryingBrokerStore.class);

    private final BrokerStore delegate;
    private final int maxAttempts;
    private final long retryDelayMs;

    public RetryingBrokerStore(BrokerStore delegate, int maxAttempts, long retryDelayMs) {
        this.delegate = delegate;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMs = Math.max(0L, retryDelayMs);
    }

    @Override
    public void init() {
        withRetry("init", () -> {
            delegate.init();
            return null;
        });
    }

    @Override
    public void append(String key, String value) {
        withRetry("append " + key, () -> {
            delegate.append(key, value);
            return null;
        });
    }

    @Override
    public void pushFront(String key, String value, int maxLength) {
        withRetry("pushFront " + key, () -> {
            delegate.pushFront(key, value, maxLength);
            return null;
        });
    }

    @Override
    public List<String> range(String key, int limit) {
        return withRetry("range " + key, () -> delegate.range(key, limit));
    }

    @Override
    public List<String> readAll(String key, boolean clear) {
        return withRetry("readAll " + key, () -> delegate.readAll(key, clear));
    }

    @Override
    public long size(String key) {
        return withRetry("size " + key, () -> delegate.size(key));
    }

    @Override
    public Set<String> keys(String prefix) {
        return withRetry("keys " + prefix, () -> delegate.keys(prefix));
    }

    @Override
    public void close() {
        delegate.close();
    }

    private <T> T withRetry(String context, Supplier<T> operation) {
        StoreException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (StoreException e) {
                last = e;
                log.warn("Store attempt {}/{} failed for {}: {}", attempt, maxAttempts, context, e.getMessage());
                if (attempt < maxAttempts && !sleep(retryDelayMs * attempt)) {
                    break;
                }
            }
        }
        throw last;
    }

    private static boolean sleep(long millis) {
        if (millis <= 0L) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
