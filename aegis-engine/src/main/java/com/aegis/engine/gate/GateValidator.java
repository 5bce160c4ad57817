package com.aegis.engine.gate;

import com.aegis.core.domain.Evidence;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Named rule applied to the evidence a gate check matched.
 */
@FunctionalInterface
public interface GateValidator {

    /**
     * @param evidence the matched evidence
     * @param params   the check's parameters; an empty object when none were given
     */
    ValidationOutcome validate(Evidence evidence, JsonNode params);
}
