package com.pagesentry.analyze.dlq;

/**
 * List-like backing store for serialized dead letters. FIFO per kind.
 */
public interface DeadLetterStore {
    /**
     * @return false when the store could not accept the entry
     */
    boolean push(String kind, String payload);

    /**
     * Oldest entry of {@code kind}, or null when empty or unavailable.
     */
    String pop(String kind);

    long size(String kind);

    /**
     * Removes entries past their TTL where the store does not expire them itself.
     *
     * @return number of entries removed
     */
    default int purgeExpired() {
        return 0;
    }
}
