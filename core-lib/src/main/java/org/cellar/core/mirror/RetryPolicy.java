package org.cellar.core.mirror;

/**
 * Bounded exponential backoff for mirror writes.
 *
 * @param maxAttempts        total attempts including the first one
 * @param initialBackoffMillis delay before the second attempt
 * @param maxBackoffMillis   upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMillis, long maxBackoffMillis) {

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
		}
		if (initialBackoffMillis < 0 || maxBackoffMillis < initialBackoffMillis) {
			throw new IllegalArgumentException("Invalid backoff bounds: " + initialBackoffMillis + ".." + maxBackoffMillis);
		}
	}

	public static RetryPolicy none() {
		return new RetryPolicy(1, 0, 0);
	}

	/**
	 * Delay to wait after the given failed attempt (1-based).
	 */
	public long backoffMillis(int failedAttempt) {
		long delay = initialBackoffMillis;
		for (int i = 1; i < failedAttempt && delay < maxBackoffMillis; i++) {
			delay *= 2;
		}
		return Math.min(delay, maxBackoffMillis);
	}
}
