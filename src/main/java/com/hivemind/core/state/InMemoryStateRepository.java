package com.hivemind.core.state;

/**
 * Keeps the state document in memory. Used when no state file is configured and in tests.
 */
public class InMemoryStateRepository implements StateRepository {

    private final StateMapper mapper;
    private byte[] committed;
    private long version;

    public InMemoryStateRepository() {
        this(new StateMapper());
    }

    public InMemoryStateRepository(StateMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public synchronized HierarchyState load() {
        if (committed == null) {
            return new HierarchyState();
        }
        HierarchyState state = mapper.read(committed);
        state.setVersion(version);
        return state;
    }

    @Override
    public synchronized long currentVersion() {
        return version;
    }

    @Override
    public synchronized long save(HierarchyState state, long expectedVersion) {
        if (version != expectedVersion) {
            throw new ConcurrentUpdateException(expectedVersion, version);
        }
        version = expectedVersion + 1;
        state.setVersion(version);
        committed = mapper.write(state);
        return version;
    }
}
