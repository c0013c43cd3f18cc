package com.guardian.rag.controller;

import com.guardian.rag.entity.PolicyDocument;
import com.guardian.rag.index.IndexException;
import com.guardian.rag.ingest.IngestionException;
import com.guardian.rag.llm.EmbeddingException;
import com.guardian.rag.service.PolicyService;
import com.guardian.rag.service.PolicyService.UploadResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class PolicyController {

    private final PolicyService policyService;

    @PostMapping("/upload-policy")
    public ResponseEntity<Map<String, Object>> uploadPolicy(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(defaultValue = "Unnamed Policy") String name,
            @RequestParam(required = false) String description,
            @RequestParam(required = false) String keywords,
            @RequestParam(defaultValue = "medium") String severity) {
        log.info("Received policy upload: name={}, file={}", name, file == null ? null : file.getOriginalFilename());

        try {
            UploadResult result = policyService.upload(file, name, description, keywords, severity);

            Map<String, Object> response = new HashMap<>();
            response.put("message", "Policy uploaded successfully");
            response.put("id", result.id());
            response.put("chunks", result.chunks());
            return ResponseEntity.ok(response);
        } catch (IngestionException e) {
            log.warn("Rejected policy upload: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (EmbeddingException | IndexException e) {
            log.error("Failed to index policy '{}'", name, e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Failed to process policy: " + e.getMessage()));
        }
    }

    @DeleteMapping("/delete-policy/{id}")
    public ResponseEntity<Map<String, Object>> deletePolicy(@PathVariable String id) {
        try {
            policyService.delete(id);
            return ResponseEntity.ok(Map.of("message", "Policy " + id + " deleted successfully"));
        } catch (RuntimeException e) {
            log.error("Failed to delete policy {}", id, e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Failed to delete policy: " + e.getMessage()));
        }
    }

    @GetMapping("/policies")
    public ResponseEntity<List<PolicyDocument>> listPolicies() {
        return ResponseEntity.ok(policyService.list());
    }
}
