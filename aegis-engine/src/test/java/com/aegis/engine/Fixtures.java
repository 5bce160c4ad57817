package com.aegis.engine;

import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.EvidenceType;
import com.aegis.core.json.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Evidence builders shared by engine tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    private Fixtures() {
    }

    public static JsonNode json(String text) {
        try {
            return CanonicalJson.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Evidence evidence(String id, String projectId, String runId, EvidenceType type, String content) {
        return new Evidence(id, projectId, runId, "ci", type, T0, json(content), Map.of());
    }

    public static Evidence named(String id, String projectId, String runId, EvidenceType type, String name,
                                 String content) {
        return new Evidence(id, projectId, runId, "ci", type, T0, json(content), Map.of(Evidence.NAME_KEY, name));
    }

    public static Evidence testReport(String id, String projectId, String runId, int failed, int passed) {
        return evidence(id, projectId, runId, EvidenceType.TEST_REPORT,
                "{\"failed\":" + failed + ",\"passed\":" + passed + "}");
    }

    /**
     * Clean scan results satisfying every gate of the gate_evaluation phase.
     */
    public static List<Evidence> passingScans(String projectId, String runId) {
        return List.of(
                named(runId + "-unit", projectId, runId, EvidenceType.TEST_REPORT, "unit_tests",
                        "{\"failed\":0,\"passed\":12}"),
                named(runId + "-sast", projectId, runId, EvidenceType.TEST_REPORT, "sast_scan",
                        "{\"summary\":{\"critical\":0,\"high\":0,\"low\":3}}"),
                named(runId + "-secrets", projectId, runId, EvidenceType.VULN_REPORT, "secrets_scan",
                        "{\"findings\":[]}"),
                named(runId + "-deps", projectId, runId, EvidenceType.VULN_REPORT, "dependency_scan",
                        "{\"vulnerabilities\":[{\"id\":\"CVE-1\",\"severity\":\"low\"}]}"));
    }
}
