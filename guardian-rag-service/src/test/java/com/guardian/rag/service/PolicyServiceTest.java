package com.guardian.rag.service;

import com.guardian.rag.chunk.WordWindowChunker;
import com.guardian.rag.entity.PolicyDocument;
import com.guardian.rag.index.Distance;
import com.guardian.rag.index.InMemoryVectorIndex;
import com.guardian.rag.index.IndexManager;
import com.guardian.rag.index.ScoredCandidate;
import com.guardian.rag.ingest.DocumentLoader;
import com.guardian.rag.ingest.IngestionException;
import com.guardian.rag.metrics.GuardianMetrics;
import com.guardian.rag.repository.PolicyDocumentRepository;
import com.guardian.rag.testsupport.WordHashEmbeddingsClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PolicyServiceTest {

    private static final String COLLECTION = "policies";

    private InMemoryVectorIndex index;
    private WordHashEmbeddingsClient embeddings;
    private PolicyDocumentRepository repository;
    private PolicyService service;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
        embeddings = new WordHashEmbeddingsClient(16);
        repository = mock(PolicyDocumentRepository.class);
        IndexManager indexManager = new IndexManager(index, embeddings, 4, Distance.COSINE,
                new GuardianMetrics(new SimpleMeterRegistry()));
        service = new PolicyService(new DocumentLoader(new WordWindowChunker(5, 1)), indexManager, repository, COLLECTION);
    }

    @Test
    void testUploadIndexesChunksAndRecordsPolicy() {
        MockMultipartFile file = textFile("conduct.md", "Employees must never share passwords with anyone outside the security team.");

        PolicyService.UploadResult result = service.upload(file, "Conduct", "Rules", "passwords", "HIGH");

        assertEquals(3, result.chunks());
        assertEquals(3, index.count(COLLECTION));

        ScoredCandidate hit = index.search(COLLECTION, embeddings.embed(List.of("passwords")).first(), 1).get(0);
        assertEquals(result.id(), hit.payload().docId());
        assertEquals("high", hit.payload().metadata().get("severity"));
        assertEquals("Conduct", hit.payload().metadata().get("name"));

        ArgumentCaptor<PolicyDocument> saved = ArgumentCaptor.forClass(PolicyDocument.class);
        verify(repository).save(saved.capture());
        assertEquals(result.id(), saved.getValue().getId());
        assertEquals("high", saved.getValue().getSeverity());
        assertEquals("conduct.md", saved.getValue().getFilename());
        assertEquals(3, saved.getValue().getChunkCount());
        assertEquals(COLLECTION, saved.getValue().getCollection());
        assertNotNull(saved.getValue().getCreatedAt());
    }

    @Test
    void testDisallowedExtensionIsRejectedBeforeIndexing() {
        MockMultipartFile file = textFile("policy.docx", "content");

        assertThrows(IngestionException.class, () -> service.upload(file, "P", null, null, "medium"));
        assertEquals(0, index.count(COLLECTION));
        verify(repository, never()).save(any());
    }

    @Test
    void testMissingFileIsRejected() {
        assertThrows(IngestionException.class, () -> service.upload(null, "P", null, null, "medium"));
        assertThrows(IngestionException.class,
                () -> service.upload(new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0]), "P", null, null, "medium"));
    }

    @Test
    void testInvalidSeverityIsRejected() {
        MockMultipartFile file = textFile("p.txt", "some policy text");

        assertThrows(IngestionException.class, () -> service.upload(file, "P", null, null, "extreme"));
        assertEquals(0, embeddings.calls());
    }

    @Test
    void testMissingNameAndSeverityAreDefaulted() {
        service.upload(textFile("p.txt", "lock your screen"), null, null, null, null);

        ArgumentCaptor<PolicyDocument> saved = ArgumentCaptor.forClass(PolicyDocument.class);
        verify(repository).save(saved.capture());
        assertEquals(PolicyService.DEFAULT_NAME, saved.getValue().getName());
        assertEquals("medium", saved.getValue().getSeverity());
    }

    @Test
    void testOverlongNameIsRejectedBeforeIndexing() {
        String name = "n".repeat(PolicyService.MAX_NAME + 1);

        assertThrows(IngestionException.class, () -> service.upload(textFile("p.txt", "lock your screen"), name, null, null, "low"));
        assertEquals(0, index.count(COLLECTION));
        assertEquals(0, embeddings.calls());
    }

    @Test
    void testRegistryFailureRemovesIndexedChunks() {
        when(repository.save(any())).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class,
                () -> service.upload(textFile("p.txt", "lock your screen when away"), "P", null, null, "low"));
        assertEquals(0, index.count(COLLECTION));
    }

    @Test
    void testWhitespaceOnlyFileIsRejected() {
        assertThrows(IngestionException.class, () -> service.upload(textFile("p.txt", " \n\t "), "P", null, null, "low"));
    }

    @Test
    void testDeleteRemovesPointsAndRow() {
        PolicyService.UploadResult first = service.upload(textFile("a.txt", "alpha beta gamma"), "A", null, null, "low");
        service.upload(textFile("b.txt", "delta epsilon"), "B", null, null, "low");
        when(repository.existsById(first.id())).thenReturn(true);

        service.delete(first.id());

        assertEquals(1, index.count(COLLECTION));
        verify(repository).deleteById(first.id());
    }

    @Test
    void testDeleteUnknownIdIsNotAnError() {
        when(repository.existsById("missing")).thenReturn(false);

        assertDoesNotThrow(() -> service.delete("missing"));
        verify(repository, never()).deleteById(any());
    }

    private static MockMultipartFile textFile(String name, String content) {
        return new MockMultipartFile("file", name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }
}
