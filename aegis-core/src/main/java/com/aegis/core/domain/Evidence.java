package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable fact about project activity: a scan result, a test report, a
 * decision, an artifact.
 * <p>
 * {@code content} is an opaque JSON tree. It is copied on construction; once
 * the evidence is signed, later comparisons go through the recorded content
 * hash, never through the tree itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Evidence(
        String id,
        String projectId,
        String runId,
        String source,
        EvidenceType type,
        Instant timestamp,
        JsonNode content,
        Map<String, String> metadata
) {
    /** Metadata key carrying the evidence name matched by gate {@code mustMatch} filters. */
    public static final String NAME_KEY = "name";

    public Evidence {
        Objects.requireNonNull(id, "Evidence ID cannot be null");
        Objects.requireNonNull(type, "Evidence type cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        content = content != null ? content.deepCopy() : NullNode.getInstance();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * A copy of the content tree. Changing it never affects this evidence.
     */
    @Override
    public JsonNode content() {
        return content.deepCopy();
    }

    /**
     * The evidence name used by gate name filters, or null when unnamed.
     */
    @JsonIgnore
    public String name() {
        return metadata.get(NAME_KEY);
    }

    public Evidence withMetadata(Map<String, String> newMetadata) {
        return new Evidence(id, projectId, runId, source, type, timestamp, content, newMetadata);
    }
}
