package io.github.cyfko.mqlfilter.core.config;

/**
 * Complexity limits applied while compiling a filter document, for DoS protection.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>complexityLimit</strong>: maximum number of pending items on the compiler's
 *   work stack, checked before each item is processed. It bounds both the breadth (many
 *   sibling keys) and the depth (deep nesting) of a document. {@value #UNLIMITED} disables
 *   the check.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (no limit, trusted callers)
 * CompilePolicy policy = CompilePolicy.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * CompilePolicy policy = CompilePolicy.strict();
 *
 * // Relaxed (for internal batch jobs with large generated filters)
 * CompilePolicy policy = CompilePolicy.relaxed();
 *
 * // Custom
 * CompilePolicy policy = CompilePolicy.builder()
 *     .complexityLimit(250)
 *     .build();
 * }</pre>
 *
 * @param policyName      descriptive name, reported in logs
 * @param complexityLimit maximum work stack size, or {@value #UNLIMITED}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompilePolicy(
    String policyName,
    int complexityLimit
) {

    /** Complexity limit value disabling the check. */
    public static final int UNLIMITED = 0;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the limit negative
     */
    public CompilePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (complexityLimit < 0) {
            throw new IllegalArgumentException("complexityLimit must be positive or " + UNLIMITED + ", got: " + complexityLimit);
        }
    }

    /**
     * @return {@code true} if a complexity limit is enforced
     */
    public boolean isLimited() {
        return complexityLimit != UNLIMITED;
    }

    /**
     * Default configuration: no complexity limit.
     *
     * @return default configuration
     */
    public static CompilePolicy defaults() {
        return new CompilePolicy(PolicyName.DEFAULT_POLICY.name(), UNLIMITED);
    }

    /**
     * Strict configuration for public APIs and untrusted input.
     * <ul>
     *   <li>Complexity limit: 100 pending items</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static CompilePolicy strict() {
        return new CompilePolicy(PolicyName.STRICT_POLICY.name(), 100);
    }

    /**
     * Relaxed configuration for internal, trusted systems.
     * <ul>
     *   <li>Complexity limit: 10000 pending items</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static CompilePolicy relaxed() {
        return new CompilePolicy(PolicyName.RELAXED_POLICY.name(), 10_000);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default mode.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _complexityLimit = UNLIMITED;

        private Builder() {}

        public CompilePolicy build() {
            return new CompilePolicy(_policyName, _complexityLimit);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder complexityLimit(int complexityLimit) { this._complexityLimit = complexityLimit; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
