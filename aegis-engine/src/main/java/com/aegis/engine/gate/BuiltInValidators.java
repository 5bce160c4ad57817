package com.aegis.engine.gate;

import com.aegis.core.domain.Evidence;
import com.aegis.core.json.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validators every registry starts with. Each reads the evidence content as
 * JSON; content submitted as a JSON-encoded string is parsed first.
 */
public final class BuiltInValidators {

    public static final String TESTS_PASSED = "tests_passed";
    public static final String NO_CRITICAL_HIGH_FINDINGS = "no_critical_high_findings";
    public static final String NO_SECRETS_FOUND = "no_secrets_found";
    public static final String NO_CRITICAL_HIGH_VULNS = "no_critical_high_vulns";
    public static final String FILE_EXISTS = "file_exists";
    public static final String REVIEW_PASSED = "review_passed";

    private static final List<String> DEFAULT_SEVERITIES = List.of("critical", "high");
    private static final String INVALID_FORMAT = "Invalid evidence format";

    private BuiltInValidators() {
    }

    public static void registerAll(ValidatorRegistry registry) {
        registry.register(TESTS_PASSED, BuiltInValidators::testsPassed)
                .register(NO_CRITICAL_HIGH_FINDINGS, BuiltInValidators::noCriticalHighFindings)
                .register(NO_SECRETS_FOUND, BuiltInValidators::noSecretsFound)
                .register(NO_CRITICAL_HIGH_VULNS, BuiltInValidators::noCriticalHighVulns)
                .register(FILE_EXISTS, BuiltInValidators::fileExists)
                .register(REVIEW_PASSED, BuiltInValidators::reviewPassed);
    }

    /**
     * Passes when {@code failed} is 0.
     */
    static ValidationOutcome testsPassed(Evidence evidence, JsonNode params) {
        JsonNode content = content(evidence);
        JsonNode failed = content != null ? content.get("failed") : null;
        if (failed == null || !failed.isNumber()) {
            return ValidationOutcome.error("Invalid test report format");
        }
        if (failed.asLong() == 0) {
            JsonNode passed = content.get("passed");
            long count = passed != null && passed.isNumber() ? passed.asLong() : 0;
            return ValidationOutcome.passed("All " + count + " tests passed");
        }
        return ValidationOutcome.failed(failed.asLong() + " tests failed");
    }

    /**
     * Passes when {@code summary.critical} and {@code summary.high} are both
     * zero or absent.
     */
    static ValidationOutcome noCriticalHighFindings(Evidence evidence, JsonNode params) {
        JsonNode content = content(evidence);
        if (content == null) {
            return ValidationOutcome.failed(INVALID_FORMAT);
        }
        JsonNode summary = content.path("summary");
        long critical = summary.path("critical").asLong(0);
        long high = summary.path("high").asLong(0);
        if (critical > 0 || high > 0) {
            return ValidationOutcome.failed(critical + " critical, " + high + " high findings detected");
        }
        return ValidationOutcome.passed("No critical/high findings");
    }

    static ValidationOutcome noSecretsFound(Evidence evidence, JsonNode params) {
        JsonNode content = content(evidence);
        if (content == null) {
            return ValidationOutcome.failed(INVALID_FORMAT);
        }
        JsonNode findings = content.path("findings");
        int count = findings.isArray() ? findings.size() : 0;
        if (count > 0) {
            return ValidationOutcome.failed(count + " secrets detected");
        }
        return ValidationOutcome.passed("No secrets found");
    }

    /**
     * Fails on any {@code vulnerabilities[].severity} listed in the
     * {@code severity} param (critical and high by default), case-insensitively.
     */
    static ValidationOutcome noCriticalHighVulns(Evidence evidence, JsonNode params) {
        JsonNode content = content(evidence);
        if (content == null) {
            return ValidationOutcome.failed(INVALID_FORMAT);
        }
        Set<String> severities = severities(params);
        int matching = 0;
        for (JsonNode vulnerability : content.path("vulnerabilities")) {
            String severity = vulnerability.path("severity").asText("").toLowerCase(Locale.ROOT);
            if (severities.contains(severity)) {
                matching++;
            }
        }
        String label = String.join("/", severities);
        if (matching > 0) {
            return ValidationOutcome.failed(matching + " " + label + " vulnerabilities");
        }
        return ValidationOutcome.passed("No " + label + " vulnerabilities");
    }

    /**
     * Passes when the file named by {@code file_path} (content first, then
     * metadata) exists, resolved against the optional {@code root} param.
     */
    static ValidationOutcome fileExists(Evidence evidence, JsonNode params) {
        JsonNode content = content(evidence);
        String filePath = content != null ? content.path("file_path").asText(null) : null;
        if (filePath == null) {
            filePath = evidence.metadata().get("file_path");
        }
        if (filePath == null || filePath.isBlank()) {
            return ValidationOutcome.error("Evidence does not name a file_path");
        }
        try {
            Path path = Path.of(filePath);
            String root = params != null ? params.path("root").asText(null) : null;
            if (root != null && !path.isAbsolute()) {
                path = Path.of(root).resolve(path);
            }
            if (Files.exists(path)) {
                return ValidationOutcome.passed("File exists: " + filePath);
            }
            return ValidationOutcome.failed("File not found: " + filePath);
        } catch (InvalidPathException e) {
            return ValidationOutcome.error("Invalid file path: " + filePath);
        }
    }

    static ValidationOutcome reviewPassed(Evidence evidence, JsonNode params) {
        JsonNode content = content(evidence);
        JsonNode passed = content != null ? content.get("passed") : null;
        if (passed == null || !passed.isBoolean()) {
            return ValidationOutcome.error("Invalid review format");
        }
        String reviewer = content.path("reviewerId").asText("unknown");
        if (passed.asBoolean()) {
            return ValidationOutcome.passed("Review passed by " + reviewer);
        }
        return ValidationOutcome.failed("Review rejected by " + reviewer);
    }

    /**
     * The content as a JSON object, parsing JSON-encoded strings; null when
     * the content is not an object.
     */
    static JsonNode content(Evidence evidence) {
        JsonNode content = evidence.content();
        if (content.isTextual()) {
            try {
                content = CanonicalJson.mapper().readTree(content.asText());
            } catch (JsonProcessingException e) {
                return null;
            }
        }
        return content != null && content.isObject() ? content : null;
    }

    private static Set<String> severities(JsonNode params) {
        JsonNode configured = params != null ? params.get("severity") : null;
        if (configured == null || configured.isNull()) {
            return new LinkedHashSet<>(DEFAULT_SEVERITIES);
        }
        Set<String> result = new LinkedHashSet<>();
        if (configured.isArray()) {
            configured.forEach(value -> result.add(value.asText().toLowerCase(Locale.ROOT)));
        } else {
            result.add(configured.asText().toLowerCase(Locale.ROOT));
        }
        return result;
    }
}
