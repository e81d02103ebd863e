package io.github.drompincen.codeforge.persistence.repository;

import io.github.drompincen.codeforge.persistence.document.MemoryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MemoryRepository extends MongoRepository<MemoryDocument, String> {

    Optional<MemoryDocument> findByProjectIdAndKey(String projectId, String key);

    List<MemoryDocument> findByProjectIdOrderByCreatedAtAsc(String projectId);

    long deleteByProjectIdAndKey(String projectId, String key);

    void deleteByProjectId(String projectId);
}
