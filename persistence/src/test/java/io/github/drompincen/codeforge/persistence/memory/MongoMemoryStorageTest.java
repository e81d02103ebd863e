package io.github.drompincen.codeforge.persistence.memory;

import io.github.drompincen.codeforge.persistence.document.MemoryDocument;
import io.github.drompincen.codeforge.persistence.repository.MemoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoMemoryStorageTest {

    @Mock
    private MemoryRepository memoryRepository;

    private MongoMemoryStorage storage;

    @BeforeEach
    void setUp() {
        storage = new MongoMemoryStorage(memoryRepository);
    }

    @Test
    void saveCreatesDocumentForNewKey() {
        when(memoryRepository.findByProjectIdAndKey("p1", "stack")).thenReturn(Optional.empty());

        storage.save("p1", "stack", "vanilla js");

        ArgumentCaptor<MemoryDocument> captor = ArgumentCaptor.forClass(MemoryDocument.class);
        verify(memoryRepository).save(captor.capture());
        MemoryDocument saved = captor.getValue();
        assertThat(saved.getMemoryId()).isNotBlank();
        assertThat(saved.getProjectId()).isEqualTo("p1");
        assertThat(saved.getValue()).isEqualTo("vanilla js");
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    void saveOverwritesExistingValue() {
        MemoryDocument existing = doc("stack", "old");
        when(memoryRepository.findByProjectIdAndKey("p1", "stack")).thenReturn(Optional.of(existing));

        storage.save("p1", "stack", "new");

        verify(memoryRepository).save(existing);
        assertThat(existing.getValue()).isEqualTo("new");
        assertThat(existing.getMemoryId()).isEqualTo("m-stack");
    }

    @Test
    void listKeepsRepositoryOrder() {
        when(memoryRepository.findByProjectIdOrderByCreatedAtAsc("p1"))
                .thenReturn(List.of(doc("b", "2"), doc("a", "1")));

        assertThat(storage.list("p1")).containsExactly(
                org.assertj.core.api.Assertions.entry("b", "2"),
                org.assertj.core.api.Assertions.entry("a", "1"));
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() {
        when(memoryRepository.deleteByProjectIdAndKey("p1", "a")).thenReturn(1L);
        when(memoryRepository.deleteByProjectIdAndKey("p1", "b")).thenReturn(0L);

        assertThat(storage.delete("p1", "a")).isTrue();
        assertThat(storage.delete("p1", "b")).isFalse();
    }

    @Test
    void recallMapsValue() {
        when(memoryRepository.findByProjectIdAndKey(any(), any())).thenReturn(Optional.of(doc("a", "1")));

        assertThat(storage.recall("p1", "a")).contains("1");
    }

    private static MemoryDocument doc(String key, String value) {
        MemoryDocument doc = new MemoryDocument();
        doc.setMemoryId("m-" + key);
        doc.setProjectId("p1");
        doc.setKey(key);
        doc.setValue(value);
        doc.setCreatedAt(Instant.now());
        return doc;
    }
}
