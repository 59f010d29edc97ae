package com.hivemind.core.state;

/**
 * A compare-and-swap commit lost against another writer. Retried inside the store.
 */
public class ConcurrentUpdateException extends HivemindException {

    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrentUpdateException(long expectedVersion, long actualVersion) {
        super("State version moved from " + expectedVersion + " to " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
