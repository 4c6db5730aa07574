package in.greenhouse.infrastructure.gateway;

import in.greenhouse.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Fixed-delay retry with a bounded number of attempts for gateway calls.
 *
 * Only {@link GatewayTransientException} is retried. Authentication and not-found
 * failures propagate on the first attempt.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .delay(Duration.ofSeconds(1))
 *     .maxAttempts(3)
 *     .build();
 *
 * JsonNode feed = policy.execute("getFeed:" + key, () -> rest.getFeed(key));
 * </pre>
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /**
     * Pause between attempts. Replaced in tests to avoid real sleeping.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration delay;
    private final int maxAttempts;
    private final Sleeper sleeper;

    private RetryPolicy(Duration delay, int maxAttempts, Sleeper sleeper) {
        this.delay = delay;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
    }

    /**
     * Run the call, retrying transient failures.
     *
     * @throws GatewayTransientException when every attempt failed transiently
     * @throws GatewayException on the first non-transient failure
     */
    public <T> T execute(String operation, Supplier<T> call) {
        GatewayTransientException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (GatewayTransientException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.warn("[RETRY] {} failed (attempt {}/{}): {}; retrying in {}ms",
                    operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                pause();
            }
        }
        log.error("[RETRY] {} failed after {} attempts", operation, maxAttempts);
        throw last;
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    private void pause() {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayTransientException("retry", "Interrupted while waiting to retry", e);
        }
    }

    public Duration getDelay() {
        return delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gateway policy from configuration (defaults: 3 attempts, 1 second apart).
     */
    public static RetryPolicy forGateway(GatewayConfig config) {
        return builder()
            .delay(config.retryDelay())
            .maxAttempts(config.maxRetries())
            .build();
    }

    public static class Builder {
        private Duration delay = Duration.ofSeconds(1);
        private int maxAttempts = 3;
        private Sleeper sleeper = d -> Thread.sleep(d.toMillis());

        public Builder delay(Duration delay) {
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay must not be negative");
            }
            this.delay = delay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            if (sleeper == null) {
                throw new IllegalArgumentException("Sleeper must not be null");
            }
            this.sleeper = sleeper;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(delay, maxAttempts, sleeper);
        }
    }
}
