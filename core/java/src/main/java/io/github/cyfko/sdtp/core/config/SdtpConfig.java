package io.github.cyfko.sdtp.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of an {@link io.github.cyfko.sdtp.core.SdtpDispatcher}.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li><strong>requestTimeout</strong>: how long a caller waits for rows (default: 30 seconds)</li>
 *   <li><strong>workerThreads</strong>: size of the row retrieval pool (default: available processors)</li>
 *   <li><strong>filterPolicy</strong>: limits on filter documents (default: {@link FilterPolicy#defaults()})</li>
 *   <li><strong>cachePolicy</strong>: validated-filter cache (default: {@link CachePolicy#defaults()})</li>
 * </ul>
 *
 * <pre>{@code
 * SdtpConfig config = SdtpConfig.builder()
 *     .requestTimeout(Duration.ofSeconds(5))
 *     .filterPolicy(FilterPolicy.strict())
 *     .cachePolicy(CachePolicy.none())
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SdtpConfig {

    private final Duration requestTimeout;
    private final int workerThreads;
    private final FilterPolicy filterPolicy;
    private final CachePolicy cachePolicy;

    private SdtpConfig(Builder builder) {
        this.requestTimeout = builder.requestTimeout;
        this.workerThreads = builder.workerThreads;
        this.filterPolicy = builder.filterPolicy;
        this.cachePolicy = builder.cachePolicy;
    }

    public static SdtpConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public Duration getRequestTimeout() { return requestTimeout; }
    public int getWorkerThreads() { return workerThreads; }
    public FilterPolicy getFilterPolicy() { return filterPolicy; }
    public CachePolicy getCachePolicy() { return cachePolicy; }

    @Override
    public String toString() {
        return "SdtpConfig{requestTimeout=" + requestTimeout
                + ", workerThreads=" + workerThreads
                + ", filterPolicy=" + filterPolicy.policyName()
                + ", cachePolicy=" + cachePolicy + '}';
    }

    public static final class Builder {
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private FilterPolicy filterPolicy = FilterPolicy.defaults();
        private CachePolicy cachePolicy = CachePolicy.defaults();

        public Builder requestTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "requestTimeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive, got: " + timeout);
            }
            this.requestTimeout = timeout;
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive, got: " + threads);
            }
            this.workerThreads = threads;
            return this;
        }

        public Builder filterPolicy(FilterPolicy policy) {
            this.filterPolicy = Objects.requireNonNull(policy, "filterPolicy");
            return this;
        }

        public Builder cachePolicy(CachePolicy policy) {
            this.cachePolicy = Objects.requireNonNull(policy, "cachePolicy");
            return this;
        }

        public SdtpConfig build() { return new SdtpConfig(this); }
    }
}
