package io.github.cyfko.sdtp.core.config;

/**
 * Size limits applied to incoming filter documents before they are validated.
 * <p>
 * Filter documents come from untrusted clients. Bounding their depth and node count keeps the
 * recursive parser and validator away from stack exhaustion and runaway work. A document over
 * either limit is rejected with a {@code SpecError}.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * FilterPolicy.defaults();   // depth 32, 1000 nodes
 * FilterPolicy.strict();     // depth 8, 100 nodes
 * FilterPolicy.relaxed();    // depth 128, 10000 nodes
 *
 * FilterPolicy.builder()
 *     .maxDepth(16)
 *     .maxNodes(200)
 *     .build();
 * }</pre>
 *
 * @param policyName label shown in logs
 * @param maxDepth   deepest allowed nesting; a lone leaf has depth 1
 * @param maxNodes   largest allowed number of leaves, combinators and operand list elements
 * @since 1.0.0
 */
public record FilterPolicy(
        String policyName,
        int maxDepth,
        int maxNodes
) {

    public FilterPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive, got: " + maxNodes);
        }
    }

    public static FilterPolicy defaults() {
        return new FilterPolicy(PolicyName.DEFAULT_POLICY.name(), 32, 1000);
    }

    /**
     * For endpoints exposed to arbitrary clients.
     *
     * @return strict limits
     */
    public static FilterPolicy strict() {
        return new FilterPolicy(PolicyName.STRICT_POLICY.name(), 8, 100);
    }

    /**
     * For trusted internal callers building large generated filters.
     *
     * @return relaxed limits
     */
    public static FilterPolicy relaxed() {
        return new FilterPolicy(PolicyName.RELAXED_POLICY.name(), 128, 10_000);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxDepth = 32;
        private int _maxNodes = 1000;

        private Builder() {}

        public FilterPolicy build() {
            return new FilterPolicy(_policyName, _maxDepth, _maxNodes);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder maxNodes(int maxNodes) { this._maxNodes = maxNodes; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
