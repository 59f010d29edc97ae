package com.hivemind.core.state;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Stores the state document as a JSON file shared by every agent process on the host.
 * <p>
 * Commits take an exclusive lock on a sibling {@code .lock} file, compare the on-disk
 * version with the version the mutation started from, and replace the file atomically.
 * Readers never see a half-written document.
 */
public class JsonFileStateRepository implements StateRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateRepository.class);

    private final Path stateFile;
    private final Path lockFile;
    private final StateMapper mapper;

    public JsonFileStateRepository(Path stateFile, StateMapper mapper) {
        this.stateFile = stateFile.toAbsolutePath();
        this.lockFile = this.stateFile.resolveSibling(this.stateFile.getFileName() + ".lock");
        this.mapper = mapper;
    }

    public Path getStateFile() {
        return stateFile;
    }

    @Override
    public HierarchyState load() {
        if (!Files.exists(stateFile)) {
            return new HierarchyState();
        }
        try {
            return mapper.read(Files.readAllBytes(stateFile));
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read " + stateFile, e);
        }
    }

    @Override
    public long currentVersion() {
        if (!Files.exists(stateFile)) {
            return 0L;
        }
        try (JsonParser parser = mapper.objectMapper().getFactory().createParser(stateFile.toFile())) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new StatePersistenceException("State document " + stateFile + " is not a JSON object", null);
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                parser.nextToken();
                if ("version".equals(field)) {
                    return parser.getValueAsLong(0L);
                }
                parser.skipChildren();
            }
            return 0L;
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read version of " + stateFile, e);
        }
    }

    @Override
    public long save(HierarchyState state, long expectedVersion) {
        try {
            Files.createDirectories(stateFile.getParent());
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                long actual = currentVersion();
                if (actual != expectedVersion) {
                    throw new ConcurrentUpdateException(expectedVersion, actual);
                }
                long next = expectedVersion + 1;
                state.setVersion(next);
                Path tmp = Files.createTempFile(stateFile.getParent(), "state-", ".tmp");
                try {
                    Files.write(tmp, mapper.write(state));
                    replace(tmp);
                } catch (IOException | RuntimeException e) {
                    discard(tmp, e);
                    throw e;
                }
                log.debug("Committed state version {} to {}", next, stateFile);
                return next;
            }
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to write " + stateFile, e);
        }
    }

    private static void discard(Path tmp, Exception failure) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void replace(Path tmp) throws IOException {
        try {
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", stateFile);
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
