package com.guardian.rag.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.guardian.rag.ingest.IngestionException;
import com.guardian.rag.json.Json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Caller-supplied metadata attached to every chunk of a policy document.
 *
 * <p>Only a fixed set of keys is accepted so that point payloads keep one
 * schema across uploads. Values must be JSON scalars; nulls are dropped.
 * {@code id}, when present, doubles as the document's {@code doc_id}.
 */
public final class PolicyMetadata {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String KEYWORDS = "keywords";
    public static final String SEVERITY = "severity";

    public static final Set<String> ALLOWED_KEYS = Set.of(ID, NAME, DESCRIPTION, KEYWORDS, SEVERITY);
    public static final Set<String> SEVERITIES = Set.of("low", "medium", "high", "critical");

    private static final PolicyMetadata EMPTY = new PolicyMetadata(Map.of());

    private final Map<String, Object> values;

    private PolicyMetadata(Map<String, Object> values) {
        this.values = values;
    }

    public static PolicyMetadata empty() {
        return EMPTY;
    }

    public static PolicyMetadata of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;

        Map<String, Object> validated = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : raw.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (!ALLOWED_KEYS.contains(key)) {
                throw new IngestionException("Metadata key '" + key + "' is not allowed; allowed keys: " + ALLOWED_KEYS);
            }
            if (value == null) continue;
            if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IngestionException("Metadata value for '" + key + "' must be a string, number or boolean");
            }
            validated.put(key, value);
        }

        Object severity = validated.get(SEVERITY);
        if (severity != null && !SEVERITIES.contains(severity.toString().toLowerCase())) {
            throw new IngestionException("Unknown severity '" + severity + "'; expected one of " + SEVERITIES);
        }
        if (severity != null) {
            validated.put(SEVERITY, severity.toString().toLowerCase());
        }

        return new PolicyMetadata(Collections.unmodifiableMap(validated));
    }

    /**
     * Parses a JSON object string. Blank input means no metadata.
     */
    public static PolicyMetadata parseJson(String json) {
        if (json == null || json.isBlank()) return EMPTY;
        Map<String, Object> raw;
        try {
            raw = Json.MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            throw new IngestionException("Invalid JSON in metadata: " + e.getMessage(), e);
        }
        return of(raw);
    }

    public Optional<String> policyId() {
        Object id = values.get(ID);
        return id == null || id.toString().isBlank() ? Optional.empty() : Optional.of(id.toString());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "PolicyMetadata" + values;
    }
}
