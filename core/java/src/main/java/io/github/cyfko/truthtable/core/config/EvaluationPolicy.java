package io.github.cyfko.truthtable.core.config;

/**
 * Configuration of postfix evaluation.
 *
 * <h2>Configurable Behaviour</h2>
 * <ul>
 *   <li><strong>requireSingleResult</strong>: reject an expression whose evaluation leaves more
 *   than one value on the stack (default: true). When disabled, the first value pushed is
 *   taken as the result and the others are ignored. An empty stack is always rejected.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: "A B" is an EXPRESSION_SYNTAX error
 * EvaluationPolicy policy = EvaluationPolicy.defaults();
 *
 * // Legacy: "A B" evaluates to A
 * EvaluationPolicy policy = EvaluationPolicy.legacy();
 *
 * // Custom
 * EvaluationPolicy policy = EvaluationPolicy.builder()
 *     .policyName("lenient")
 *     .requireSingleResult(false)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in error messages
 * @param requireSingleResult whether leftover stack values are an error
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationPolicy(
        String policyName,
        boolean requireSingleResult
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the policy name is blank
     */
    public EvaluationPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
    }

    /**
     * Default configuration: an expression must reduce to exactly one value.
     *
     * @return default configuration
     */
    public static EvaluationPolicy defaults() {
        return new EvaluationPolicy(PolicyName.DEFAULT_POLICY.name(), true);
    }

    /**
     * Legacy configuration: the bottom of the final stack is the result, extra values are ignored.
     *
     * @return legacy configuration
     */
    public static EvaluationPolicy legacy() {
        return new EvaluationPolicy(PolicyName.LEGACY_POLICY.name(), false);
    }

    /**
     * Creates a custom configuration. Builder parameters start as in {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private boolean _requireSingleResult = true;

        private Builder() {}

        public EvaluationPolicy build() {
            return new EvaluationPolicy(_policyName, _requireSingleResult);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder requireSingleResult(boolean require) { this._requireSingleResult = require; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        LEGACY_POLICY,
        CUSTOM_POLICY
    }
}
