package com.agenthost.common.infra;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff computation for reconnect loops.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs   delay before the first retry in milliseconds
     * @param maxMs       upper bound for any single delay
     * @param factor      multiplicative factor per attempt
     * @param jitter      jitter ratio (0..1), 0 for deterministic delays
     * @param maxAttempts retries allowed before giving up
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter, int maxAttempts) {

        /** 1s initial, doubling, five attempts, no jitter. */
        public static final Policy RECONNECT = new Policy(1000, 60_000, 2.0, 0.0, 5);

        public Policy {
            if (initialMs < 0 || maxMs < initialMs) {
                throw new IllegalArgumentException("invalid delay bounds: " + initialMs + ".." + maxMs);
            }
            if (factor < 1.0) {
                throw new IllegalArgumentException("factor must be >= 1: " + factor);
            }
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
            }
        }

        /**
         * Whether 1-based retry {@code attempt} is within the cap.
         */
        public boolean allowsAttempt(int attempt) {
            return attempt >= 1 && attempt <= maxAttempts;
        }
    }

    /**
     * Compute the backoff delay for a given attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based attempt number
     * @return delay in milliseconds (capped at {@code policy.maxMs})
     */
    public static long compute(Policy policy, int attempt) {
        double base = policy.initialMs() * Math.pow(policy.factor(), Math.max(attempt - 1, 0));
        double jitter = base * policy.jitter() * ThreadLocalRandom.current().nextDouble();
        return Math.min(policy.maxMs(), Math.round(base + jitter));
    }
}
