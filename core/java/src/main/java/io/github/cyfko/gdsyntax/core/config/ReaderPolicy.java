package io.github.cyfko.gdsyntax.core.config;

/**
 * Limits and layout settings applied while reading a script.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxContentLength</strong>: maximum number of characters accepted in one source (default: 1 000 000)</li>
 *   <li><strong>maxReadingDepth</strong>: maximum number of readers stacked at once (default: 1024)</li>
 *   <li><strong>tabWidth</strong>: column width of a tab when comparing indentation (default: 4)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ReaderPolicy policy = ReaderPolicy.defaults();
 *
 * // Strict (for editors reading untrusted files)
 * ReaderPolicy policy = ReaderPolicy.strict();
 *
 * // Relaxed (for batch tools over trusted projects)
 * ReaderPolicy policy = ReaderPolicy.relaxed();
 *
 * // Custom
 * ReaderPolicy policy = ReaderPolicy.builder()
 *     .tabWidth(8)
 *     .build();
 * }</pre>
 *
 * @param policyName       name of the policy, used in log and error messages
 * @param maxContentLength maximum character length of a source
 * @param maxReadingDepth  maximum depth of the reading stack
 * @param tabWidth         indentation width of a tab character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ReaderPolicy(
    String policyName,
    int maxContentLength,
    int maxReadingDepth,
    int tabWidth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ReaderPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be positive, got: " + maxContentLength);
        }
        if (maxReadingDepth < 8) {
            throw new IllegalArgumentException("maxReadingDepth must be at least 8, got: " + maxReadingDepth);
        }
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive, got: " + tabWidth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Content Length: 1 000 000 characters</li>
     *   <li>Max Reading Depth: 1024 readers</li>
     *   <li>Tab Width: 4</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ReaderPolicy defaults() {
        return new ReaderPolicy(PolicyName.DEFAULT_POLICY.name(), 1_000_000, 1024, 4);
    }

    /**
     * Strict configuration for sources of unknown origin.
     * <ul>
     *   <li>Max Content Length: 100 000 characters</li>
     *   <li>Max Reading Depth: 256 readers</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ReaderPolicy strict() {
        return new ReaderPolicy(PolicyName.STRICT_POLICY.name(), 100_000, 256, 4);
    }

    /**
     * Relaxed configuration for trusted batch processing.
     * <ul>
     *   <li>Max Content Length: 50 000 000 characters</li>
     *   <li>Max Reading Depth: 4096 readers</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ReaderPolicy relaxed() {
        return new ReaderPolicy(PolicyName.RELAXED_POLICY.name(), 50_000_000, 4096, 4);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxContentLength = 1_000_000;
        private int _maxReadingDepth = 1024;
        private int _tabWidth = 4;

        private Builder() {}

        public ReaderPolicy build() {
            return new ReaderPolicy(_policyName, _maxContentLength, _maxReadingDepth, _tabWidth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxContentLength(int maxContentLength) { this._maxContentLength = maxContentLength; return this; }
        public Builder maxReadingDepth(int maxReadingDepth) { this._maxReadingDepth = maxReadingDepth; return this; }
        public Builder tabWidth(int tabWidth) { this._tabWidth = tabWidth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
