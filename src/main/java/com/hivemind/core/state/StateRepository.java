package com.hivemind.core.state;

/**
 * Durable home of the versioned {@link HierarchyState} document.
 */
public interface StateRepository {

    /**
     * Loads the latest committed state, or an empty state at version 0.
     */
    HierarchyState load();

    /**
     * Version of the latest committed state.
     */
    long currentVersion();

    /**
     * Commits {@code state} if the stored version still equals {@code expectedVersion}.
     *
     * @return the new version
     * @throws ConcurrentUpdateException if another writer committed in between
     */
    long save(HierarchyState state, long expectedVersion);
}
