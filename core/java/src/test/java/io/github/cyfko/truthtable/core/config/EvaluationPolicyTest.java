package io.github.cyfko.truthtable.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EvaluationPolicy Tests")
class EvaluationPolicyTest {

    @Test
    @DisplayName("Presets")
    void testPresets() {
        assertTrue(EvaluationPolicy.defaults().requireSingleResult());
        assertEquals("DEFAULT_POLICY", EvaluationPolicy.defaults().policyName());

        assertFalse(EvaluationPolicy.legacy().requireSingleResult());
        assertEquals("LEGACY_POLICY", EvaluationPolicy.legacy().policyName());
    }

    @Test
    @DisplayName("Builder starts from the defaults")
    void testBuilderDefaults() {
        EvaluationPolicy policy = EvaluationPolicy.builder().build();

        assertTrue(policy.requireSingleResult());
        assertEquals("CUSTOM_POLICY", policy.policyName());
    }

    @Test
    @DisplayName("Builder overrides")
    void testBuilder() {
        EvaluationPolicy policy = EvaluationPolicy.builder()
                .policyName("lenient")
                .requireSingleResult(false)
                .build();

        assertEquals(new EvaluationPolicy("lenient", false), policy);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    @DisplayName("Blank policy name is rejected")
    void testBlankName(String name) {
        assertThrows(IllegalArgumentException.class, () -> new EvaluationPolicy(name, true));
    }
}
