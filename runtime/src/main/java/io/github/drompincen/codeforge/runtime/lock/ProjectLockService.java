package io.github.drompincen.codeforge.runtime.lock;

import io.github.drompincen.codeforge.persistence.document.LockDocument;
import io.github.drompincen.codeforge.persistence.repository.LockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps agent runs single-flight per project. A lock belongs to one owner token until it is
 * released or its lease runs out; long runs renew the lease between turns.
 */
@Service
public class ProjectLockService {

    private static final Logger log = LoggerFactory.getLogger(ProjectLockService.class);
    static final Duration LEASE = Duration.ofSeconds(120);

    private final LockRepository lockRepository;

    public ProjectLockService(LockRepository lockRepository) {
        this.lockRepository = lockRepository;
    }

    public Optional<String> tryAcquire(String projectId) {
        Optional<LockDocument> current = lockRepository.findByProjectId(projectId);
        if (current.filter(ProjectLockService::isLive).isPresent()) {
            log.debug("Project {} is locked by {}", projectId, current.get().getOwner());
            return Optional.empty();
        }
        current.ifPresent(stale -> {
            log.info("Dropping expired lock on project {} held by {}", projectId, stale.getOwner());
            lockRepository.delete(stale);
        });

        Instant now = Instant.now();
        LockDocument lock = new LockDocument();
        lock.setLockId(UUID.randomUUID().toString());
        lock.setProjectId(projectId);
        lock.setOwner(UUID.randomUUID().toString());
        lock.setAcquiredAt(now);
        lock.setExpiresAt(now.plus(LEASE));
        try {
            lockRepository.save(lock);
        } catch (DuplicateKeyException e) {
            log.debug("Lost the race for project {}: {}", projectId, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(lock.getOwner());
    }

    public boolean renew(String projectId, String owner) {
        Optional<LockDocument> held = heldBy(projectId, owner);
        held.ifPresent(lock -> {
            lock.setExpiresAt(Instant.now().plus(LEASE));
            lockRepository.save(lock);
        });
        return held.isPresent();
    }

    public void release(String projectId, String owner) {
        heldBy(projectId, owner).ifPresent(lockRepository::delete);
    }

    public boolean isLocked(String projectId) {
        return lockRepository.findByProjectId(projectId).filter(ProjectLockService::isLive).isPresent();
    }

    private Optional<LockDocument> heldBy(String projectId, String owner) {
        return lockRepository.findByProjectId(projectId).filter(l -> l.getOwner().equals(owner));
    }

    private static boolean isLive(LockDocument lock) {
        return lock.getExpiresAt() != null && lock.getExpiresAt().isAfter(Instant.now());
    }
}
