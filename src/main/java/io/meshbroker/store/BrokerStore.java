package io.meshbroker.store;

import java.util.List;
import java.util.Set;

/**
 * Durable key/list store behind the offline queue and the audit trail.
 *
 * <p>Lists are read head-first. {@link #append} adds at the tail, {@link #pushFront}
 * at the head. Every method is atomic per key. Implementations throw
 * {@link StoreException} on persistence failure.
 */
public interface BrokerStore extends AutoCloseable {

    void init();

    void append(String key, String value);

    /**
     * Inserts at the head, then trims the list to at most {@code maxLength} entries
     * (oldest dropped). A non-positive {@code maxLength} disables trimming.
     */
    void pushFront(String key, String value, int maxLength);

    List<String> range(String key, int limit);

    /**
     * Returns the whole list and, when {@code clear} is set, empties it in the same step.
     */
    List<String> readAll(String key, boolean clear);

    long size(String key);

    Set<String> keys(String prefix);

    @Override
    void close();
}
