package io.github.drompincen.codeforge.persistence.memory;

import io.github.drompincen.codeforge.persistence.document.MemoryDocument;
import io.github.drompincen.codeforge.persistence.repository.MemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class MongoMemoryStorage implements MemoryStorage {

    private static final Logger log = LoggerFactory.getLogger(MongoMemoryStorage.class);

    private final MemoryRepository memoryRepository;

    public MongoMemoryStorage(MemoryRepository memoryRepository) {
        this.memoryRepository = memoryRepository;
    }

    @Override
    public void save(String projectId, String key, String value) {
        Instant now = Instant.now();
        MemoryDocument doc = memoryRepository.findByProjectIdAndKey(projectId, key).orElseGet(() -> {
            MemoryDocument fresh = new MemoryDocument();
            fresh.setMemoryId(UUID.randomUUID().toString());
            fresh.setProjectId(projectId);
            fresh.setKey(key);
            fresh.setCreatedAt(now);
            return fresh;
        });
        doc.setValue(value);
        doc.setUpdatedAt(now);
        memoryRepository.save(doc);
        log.debug("Saved memory '{}' for project {}", key, projectId);
    }

    @Override
    public Optional<String> recall(String projectId, String key) {
        return memoryRepository.findByProjectIdAndKey(projectId, key).map(MemoryDocument::getValue);
    }

    @Override
    public Map<String, String> list(String projectId) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (MemoryDocument doc : memoryRepository.findByProjectIdOrderByCreatedAtAsc(projectId)) {
            entries.put(doc.getKey(), doc.getValue());
        }
        return entries;
    }

    @Override
    public boolean delete(String projectId, String key) {
        return memoryRepository.deleteByProjectIdAndKey(projectId, key) > 0;
    }

    @Override
    public void clearProject(String projectId) {
        memoryRepository.deleteByProjectId(projectId);
        log.info("Cleared memories for project {}", projectId);
    }
}
