package com.aegis.engine.gate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidatorRegistryTest {

    private static final GateValidator ALWAYS = (evidence, params) -> ValidationOutcome.passed("ok");

    @Test
    void withBuiltIns_registersEveryBuiltIn() {
        assertThat(ValidatorRegistry.withBuiltIns().names()).containsExactly(
                BuiltInValidators.FILE_EXISTS,
                BuiltInValidators.NO_CRITICAL_HIGH_FINDINGS,
                BuiltInValidators.NO_CRITICAL_HIGH_VULNS,
                BuiltInValidators.NO_SECRETS_FOUND,
                BuiltInValidators.REVIEW_PASSED,
                BuiltInValidators.TESTS_PASSED);
    }

    @Test
    void register_rejectsDuplicatesAndBlankNames() {
        ValidatorRegistry registry = new ValidatorRegistry().register("custom", ALWAYS);

        assertThatThrownBy(() -> registry.register("custom", ALWAYS))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("custom");
        assertThatThrownBy(() -> registry.register(" ", ALWAYS)).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.find("custom")).containsSame(ALWAYS);
    }

    @Test
    void require_throwsForUnknownName() {
        ValidatorRegistry registry = new ValidatorRegistry();

        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.contains(null)).isFalse();
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(UnknownValidatorException.class).hasMessageContaining("nope");
    }
}
