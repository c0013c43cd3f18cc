package com.guardian.rag.service;

import com.guardian.rag.chunk.WordWindowChunker;
import com.guardian.rag.entity.PolicyDocument;
import com.guardian.rag.index.IndexManager;
import com.guardian.rag.index.PolicyMetadata;
import com.guardian.rag.ingest.DocumentChunk;
import com.guardian.rag.ingest.DocumentLoader;
import com.guardian.rag.ingest.DocumentTextExtractor;
import com.guardian.rag.ingest.IngestionException;
import com.guardian.rag.repository.PolicyDocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Uploads, deletes and lists policy documents. The vector index holds the
 * chunks; the {@link PolicyDocument} table records what was uploaded.
 */
@Slf4j
@Service
public class PolicyService {

    public static final Set<String> UPLOAD_EXTENSIONS = Set.of("txt", "md", "pdf");
    public static final String DEFAULT_NAME = "Unnamed Policy";
    public static final String DEFAULT_SEVERITY = "medium";

    // Column lengths of policy_documents
    static final int MAX_NAME = 500;
    static final int MAX_DESCRIPTION = 2000;
    static final int MAX_KEYWORDS = 1000;
    static final int MAX_FILENAME = 255;

    private final DocumentLoader loader;
    private final IndexManager indexManager;
    private final PolicyDocumentRepository repository;
    private final String collection;

    public PolicyService(
            DocumentLoader loader,
            IndexManager indexManager,
            PolicyDocumentRepository repository,
            @Value("${guardian.collection:guardianai_policies}") String collection
    ) {
        this.loader = loader;
        this.indexManager = indexManager;
        this.repository = repository;
        this.collection = collection;
    }

    public record UploadResult(String id, int chunks) {}

    /**
     * Extracts, chunks and indexes an uploaded policy under a fresh id.
     *
     * @throws IngestionException for a missing or unsupported file, unreadable content or bad metadata
     */
    @Transactional
    public UploadResult upload(MultipartFile file, String name, String description, String keywords, String severity) {
        if (file == null || file.isEmpty()) {
            throw new IngestionException("No file uploaded");
        }
        String filename = file.getOriginalFilename();
        String ext = DocumentTextExtractor.extensionOf(filename);
        if (!UPLOAD_EXTENSIONS.contains(ext)) {
            throw new IngestionException("Unsupported file type '" + ext + "'; allowed: " + UPLOAD_EXTENSIONS);
        }
        if (name == null || name.isBlank()) name = DEFAULT_NAME;
        if (severity == null || severity.isBlank()) severity = DEFAULT_SEVERITY;
        checkLength("name", name, MAX_NAME);
        checkLength("description", description, MAX_DESCRIPTION);
        checkLength("keywords", keywords, MAX_KEYWORDS);
        checkLength("filename", filename, MAX_FILENAME);

        String policyId = UUID.randomUUID().toString();
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(PolicyMetadata.ID, policyId);
        raw.put(PolicyMetadata.NAME, name);
        raw.put(PolicyMetadata.DESCRIPTION, description);
        raw.put(PolicyMetadata.KEYWORDS, keywords);
        raw.put(PolicyMetadata.SEVERITY, severity);
        PolicyMetadata metadata = PolicyMetadata.of(raw);

        String text;
        try (InputStream in = file.getInputStream()) {
            text = WordWindowChunker.normalize(DocumentTextExtractor.extract(filename, in));
        } catch (IOException e) {
            throw new IngestionException("Failed to read upload: " + filename, e);
        }
        if (text.isEmpty()) {
            throw new IngestionException("No text could be extracted from " + filename);
        }

        log.info("[POLICY] Uploading '{}' ({}) as {}", name, filename, policyId);
        List<DocumentChunk> chunks = loader.toChunks(text, policyId, filename);
        int written = indexManager.upsert(collection, chunks, metadata);

        try {
            repository.save(PolicyDocument.builder()
                    .id(policyId)
                    .name(name)
                    .description(description)
                    .keywords(keywords)
                    .severity(metadata.asMap().get(PolicyMetadata.SEVERITY).toString())
                    .filename(filename)
                    .collection(collection)
                    .chunkCount(written)
                    .createdAt(LocalDateTime.now())
                    .build());
        } catch (RuntimeException e) {
            log.error("[POLICY] Registry save failed for {}; removing its {} chunks", policyId, written);
            indexManager.deleteByDocId(collection, policyId);
            throw e;
        }

        log.info("[POLICY] Policy {} indexed with {} chunks", policyId, written);
        return new UploadResult(policyId, written);
    }

    /**
     * Removes every chunk of the policy and its registry row. Deleting an
     * unknown id is not an error.
     */
    @Transactional
    public void delete(String policyId) {
        indexManager.deleteByDocId(collection, policyId);
        if (repository.existsById(policyId)) {
            repository.deleteById(policyId);
        }
        log.info("[POLICY] Deleted policy {}", policyId);
    }

    public List<PolicyDocument> list() {
        return repository.findAllByOrderByCreatedAtDesc();
    }

    private static void checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new IngestionException("Field '" + field + "' is longer than " + max + " characters");
        }
    }
}
