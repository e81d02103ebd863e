package io.github.drompincen.codeforge.persistence.repository;

import io.github.drompincen.codeforge.persistence.document.LockDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface LockRepository extends MongoRepository<LockDocument, String> {
    Optional<LockDocument> findByProjectId(String projectId);
    void deleteByProjectId(String projectId);
}
