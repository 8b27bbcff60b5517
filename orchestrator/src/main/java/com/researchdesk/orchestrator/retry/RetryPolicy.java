package com.researchdesk.orchestrator.retry;

import com.researchdesk.orchestrator.config.ResearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff with jitter around a single call.
 *
 * Only failures accepted by the retry predicate are retried; anything else
 * propagates on the first occurrence. Before attempt n+1 the policy sleeps
 *
 * <pre>
 *   min(maxDelay, baseDelay * 2^(n-1)) * U[1 - jitter, 1 + jitter]
 * </pre>
 *
 * After maxAttempts retryable failures the last failure is rethrown.
 *
 * Stateless apart from its parameters: one instance is shared by all jobs.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Blocks the calling thread; swapped out in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int           maxAttempts;
    private final Duration      baseDelay;
    private final Duration      maxDelay;
    private final double        jitterFraction;
    private final Sleeper       sleeper;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction,
                       Sleeper sleeper, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (jitterFraction < 0 || jitterFraction > 1) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1], was " + jitterFraction);
        }
        this.maxAttempts    = maxAttempts;
        this.baseDelay      = baseDelay;
        this.maxDelay       = maxDelay;
        this.jitterFraction = jitterFraction;
        this.sleeper        = sleeper;
        this.random         = random;
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction) {
        this(maxAttempts, baseDelay, maxDelay, jitterFraction,
                d -> Thread.sleep(d.toMillis()),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public static RetryPolicy from(ResearchProperties.Retry settings) {
        return new RetryPolicy(settings.getMaxAttempts(), settings.getBaseDelay(),
                settings.getMaxDelay(), settings.getJitterFraction());
    }

    /** A policy that calls exactly once. */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0);
    }

    public int maxAttempts() { return maxAttempts; }

    /**
     * Run the call, retrying failures accepted by shouldRetry.
     *
     * If the thread is interrupted while backing off, the interrupt flag is
     * restored and the last failure is rethrown without further attempts.
     *
     * @param label       used in log lines, e.g. "academic search"
     * @param call        the operation; signals failure by throwing
     * @param shouldRetry decides whether a failure is transient
     */
    public <T> T execute(String label, Supplier<T> call, Predicate<? super RuntimeException> shouldRetry) {
        return execute(label, call, shouldRetry, () -> {});
    }

    /**
     * As {@link #execute(String, Supplier, Predicate)}, running checkpoint
     * before every attempt. A checkpoint that throws ends the retries with
     * its own exception; callers use it to abandon work for a cancelled job.
     */
    public <T> T execute(String label, Supplier<T> call, Predicate<? super RuntimeException> shouldRetry,
                         Runnable checkpoint) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            checkpoint.run();
            try {
                T result = call.get();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", label, attempt, maxAttempts);
                }
                return result;
            } catch (RuntimeException e) {
                if (!shouldRetry.test(e)) {
                    throw e;
                }
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = delayBeforeRetry(attempt);
                log.warn("{} attempt {}/{} failed ({}), retrying in {} ms",
                        label, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.info("{} interrupted while backing off after attempt {}", label, attempt);
                    throw e;
                }
            }
        }
        log.warn("{} gave up after {} attempts: {}", label, maxAttempts, last.getMessage());
        throw last;
    }

    /**
     * Backoff before the retry that follows the given (1-based) failed attempt.
     */
    Duration delayBeforeRetry(int failedAttempt) {
        long base = baseDelay.toMillis();
        // 2^(n-1), saturating long before it could overflow.
        long factor = 1L << Math.min(failedAttempt - 1, 30);
        long capped = Math.min(maxDelay.toMillis(), saturatedMultiply(base, factor));
        double jitter = 1 - jitterFraction + (2 * jitterFraction * random.getAsDouble());
        return Duration.ofMillis(Math.round(capped * jitter));
    }

    private static long saturatedMultiply(long a, long b) {
        long r = a * b;
        if (a != 0 && (r / a != b || r < 0)) return Long.MAX_VALUE;
        return r;
    }
}
