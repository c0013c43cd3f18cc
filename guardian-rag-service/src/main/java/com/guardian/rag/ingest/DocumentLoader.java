package com.guardian.rag.ingest;

import com.guardian.rag.chunk.WordWindowChunker;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns files into {@link DocumentChunk}s. Every document gets its own
 * doc id and zero-based, contiguous chunk indexes.
 */
@Slf4j
public class DocumentLoader {

    private final WordWindowChunker chunker;

    public DocumentLoader(WordWindowChunker chunker) {
        this.chunker = chunker;
    }

    /**
     * Chunks one file. Fails when the file yields no text.
     */
    public List<DocumentChunk> loadFile(Path path, String docId) {
        if (!Files.isRegularFile(path)) {
            throw new IngestionException("File not found: " + path);
        }
        String text = WordWindowChunker.normalize(DocumentTextExtractor.extract(path));
        if (text.isEmpty()) {
            throw new IngestionException("No text could be extracted from " + path);
        }
        return toChunks(text, docId, path.toString());
    }

    /**
     * Chunks every supported file below {@code dataDir}. Unreadable or empty
     * files are skipped with a warning so one bad file does not stop the run.
     */
    public List<DocumentChunk> loadDirectory(Path dataDir) {
        if (!Files.isDirectory(dataDir)) {
            throw new IngestionException("Data dir not found: " + dataDir);
        }

        List<DocumentChunk> chunks = new ArrayList<>();
        for (Path path : discoverFiles(dataDir)) {
            try {
                chunks.addAll(loadFile(path, UUID.randomUUID().toString()));
            } catch (IngestionException e) {
                log.warn("Skipping {}: {}", path, e.getMessage());
            }
        }
        return chunks;
    }

    public List<DocumentChunk> toChunks(String normalizedText, String docId, String source) {
        List<String> parts = chunker.chunk(normalizedText);
        List<DocumentChunk> out = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            out.add(new DocumentChunk(UUID.randomUUID().toString(), parts.get(i), docId, source, i));
        }
        return out;
    }

    static List<Path> discoverFiles(Path dataDir) {
        try (Stream<Path> walk = Files.walk(dataDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> DocumentTextExtractor.isSupported(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IngestionException("Failed to list " + dataDir, e);
        }
    }
}
