package com.aegis.core.domain;

import com.aegis.core.json.CanonicalJson;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GateCheckTest {

    private static Evidence evidence(EvidenceType type, Map<String, String> metadata) {
        return new Evidence("ev-1", "proj", "run", "ci", type, Instant.now(),
                JsonNodeFactory.instance.objectNode(), metadata);
    }

    @Test
    void matches_requiresSameType() {
        Gate.Check check = Gate.Check.of("tests", EvidenceType.TEST_REPORT, null);

        assertThat(check.matches(evidence(EvidenceType.TEST_REPORT, Map.of()))).isTrue();
        assertThat(check.matches(evidence(EvidenceType.VULN_REPORT, Map.of()))).isFalse();
    }

    @Test
    void matches_appliesNameFilterFromMetadata() {
        Gate.Check check = new Gate.Check("sast", EvidenceType.TEST_REPORT, null, null, List.of("semgrep"));

        assertThat(check.matches(evidence(EvidenceType.TEST_REPORT, Map.of("name", "semgrep")))).isTrue();
        assertThat(check.matches(evidence(EvidenceType.TEST_REPORT, Map.of("name", "eslint")))).isFalse();
        assertThat(check.matches(evidence(EvidenceType.TEST_REPORT, Map.of()))).isFalse();
    }

    @Test
    void gate_readsFromDeclarativeJson() throws Exception {
        String json = """
                {
                  "id": "sca_gate",
                  "phase": "phase_4_feature_loop",
                  "blocking": true,
                  "checks": [
                    {"id": "deps", "evidenceType": "vuln_report", "validator": "no_critical_high_vulns",
                     "params": {"severity": ["critical"]}}
                  ]
                }
                """;

        Gate gate = CanonicalJson.mapper().readValue(json, Gate.class);

        assertThat(gate.name()).isEqualTo("sca_gate");
        assertThat(gate.blocking()).isTrue();
        assertThat(gate.checks()).hasSize(1);
        Gate.Check check = gate.checks().get(0);
        assertThat(check.evidenceType()).isEqualTo(EvidenceType.VULN_REPORT);
        assertThat(check.params().get("severity").get(0).asText()).isEqualTo("critical");
        assertThat(check.mustMatch()).isNull();
    }

    @Test
    void paramsAndContent_cannotBeChangedThroughAccessors() {
        ObjectNode params = JsonNodeFactory.instance.objectNode().put("max", 0);
        Gate.Check check = new Gate.Check("vulns", EvidenceType.VULN_REPORT, "no_critical_high_vulns", params, null);
        params.put("max", 5);
        ((ObjectNode) check.params()).put("max", 9);

        ObjectNode content = JsonNodeFactory.instance.objectNode().put("failed", 2);
        Evidence evidence = new Evidence("ev-1", "proj", "run", "ci", EvidenceType.TEST_REPORT, Instant.now(),
                content, Map.of());
        content.put("failed", 1);
        ((ObjectNode) evidence.content()).put("failed", 0);

        assertThat(check.params().get("max").asInt()).isZero();
        assertThat(evidence.content().get("failed").asInt()).isEqualTo(2);
        assertThat(evidence.withMetadata(Map.of("name", "unit")).content()).isEqualTo(evidence.content());
    }

    @Test
    void evidenceType_rejectsUnknownWireName() {
        assertThatThrownBy(() -> EvidenceType.fromWire("spreadsheet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spreadsheet");
    }
}
