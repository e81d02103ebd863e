package io.github.drompincen.codeforge.persistence.memory;

import java.util.Map;
import java.util.Optional;

/**
 * Per-project key/value memory. Saving an existing key overwrites its value.
 */
public interface MemoryStorage {

    void save(String projectId, String key, String value);

    Optional<String> recall(String projectId, String key);

    /** Entries in insertion order. */
    Map<String, String> list(String projectId);

    boolean delete(String projectId, String key);

    void clearProject(String projectId);
}
