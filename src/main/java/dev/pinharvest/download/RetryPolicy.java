package dev.pinharvest.download;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides what happens after a failed attempt on one candidate URL.
 *
 * <ul>
 *   <li>403: rotate headers, wait 2 to 5 seconds and retry, at most {@code maxForbiddenRetries}
 *       times
 *   <li>404, other 4xx and non-image content: give up on the URL at once
 *   <li>timeouts, connection errors, 429 and 5xx: jittered exponential backoff until {@code
 *       maxAttempts} attempts were made
 * </ul>
 */
public record RetryPolicy(
		int maxAttempts,
		int maxForbiddenRetries,
		Duration initialBackoff,
		Duration maxBackoff,
		Duration forbiddenMinBackoff,
		Duration forbiddenMaxBackoff) {

	public enum Action {
		RETRY,
		ROTATE_AND_RETRY,
		NEXT_CANDIDATE
	}

	public record Decision(Action action, Duration delay) {
		static final Decision NEXT = new Decision(Action.NEXT_CANDIDATE, Duration.ZERO);
	}

	public static RetryPolicy defaults() {
		return withMaxAttempts(3);
	}

	public static RetryPolicy withMaxAttempts(int maxAttempts) {
		return new RetryPolicy(
				maxAttempts, 2, Duration.ofSeconds(1), Duration.ofSeconds(8), Duration.ofSeconds(2), Duration.ofSeconds(5));
	}

	/**
	 * @param error the failure of the last attempt
	 * @param attempts attempts made on this URL so far, including the failed one
	 * @param forbiddenRetries 403 retries already spent on this URL
	 */
	public Decision decide(DownloadException error, int attempts, int forbiddenRetries) {
		return switch (error.kind()) {
			case TIMEOUT, CONNECTION_FAILED -> transientRetry(attempts);
			case HTTP_STATUS -> decideStatus(error.statusCode(), attempts, forbiddenRetries);
			case INVALID_CONTENT, ALL_CANDIDATES_EXHAUSTED, WRITE_FAILED -> Decision.NEXT;
		};
	}

	private Decision decideStatus(int status, int attempts, int forbiddenRetries) {
		if (status == 403) {
			if (forbiddenRetries >= maxForbiddenRetries) {
				return Decision.NEXT;
			}
			long min = forbiddenMinBackoff.toMillis();
			long max = forbiddenMaxBackoff.toMillis();
			long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
			return new Decision(Action.ROTATE_AND_RETRY, Duration.ofMillis(delay));
		}
		if (status == 429 || status >= 500) {
			return transientRetry(attempts);
		}
		return Decision.NEXT;
	}

	private Decision transientRetry(int attempts) {
		if (attempts >= maxAttempts) {
			return Decision.NEXT;
		}
		// Exponential backoff with 50-100% jitter: 1s, 2s, 4s, ... capped
		long base = Math.min(initialBackoff.toMillis() * (1L << Math.min(attempts - 1, 20)), maxBackoff.toMillis());
		long delay = base / 2 + ThreadLocalRandom.current().nextLong(base / 2 + 1);
		return new Decision(Action.RETRY, Duration.ofMillis(delay));
	}
}
