package com.guardian.rag.ingest;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

public final class DocumentTextExtractor {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("txt", "md", "markdown", "pdf");

    public static String extract(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return extract(path.getFileName().toString(), in);
        } catch (IOException e) {
            throw new IngestionException("Failed to read: " + path, e);
        }
    }

    public static String extract(String filename, InputStream in) {
        try {
            if ("pdf".equals(extensionOf(filename))) return extractPdf(in);
            // Anything else is decoded as UTF-8 text, best effort
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IngestionException("Failed to extract: " + filename, e);
        }
    }

    public static boolean isSupported(String filename) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(filename));
    }

    public static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase();
    }

    private static String extractPdf(InputStream in) throws IOException {
        try (PDDocument doc = PDDocument.load(in)) {
            return new PDFTextStripper().getText(doc);
        }
    }

    private DocumentTextExtractor() {}
}
