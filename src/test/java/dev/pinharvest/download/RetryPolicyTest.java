package dev.pinharvest.download;

import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.download.RetryPolicy.Action;
import dev.pinharvest.download.RetryPolicy.Decision;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

	private static final String URL = "https://i.pinimg.com/originals/aa/p1.jpg";

	private final RetryPolicy policy = RetryPolicy.defaults();

	@Test
	void testDecide_NotFoundMovesOn() {
		// When
		Decision decision = policy.decide(DownloadException.httpStatus(URL, 404), 1, 0);

		// Then
		assertThat(decision.action()).isEqualTo(Action.NEXT_CANDIDATE);
	}

	@Test
	void testDecide_TimeoutRetriesUntilCap() {
		// Given
		DownloadException timeout = DownloadException.timeout(URL, new SocketTimeoutException("slow"));

		// When
		Decision first = policy.decide(timeout, 1, 0);
		Decision second = policy.decide(timeout, 2, 0);
		Decision third = policy.decide(timeout, 3, 0);

		// Then
		assertThat(first.action()).isEqualTo(Action.RETRY);
		assertThat(first.delay()).isBetween(Duration.ofMillis(500), Duration.ofSeconds(1));
		assertThat(second.action()).isEqualTo(Action.RETRY);
		assertThat(second.delay()).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(2));
		assertThat(third.action()).isEqualTo(Action.NEXT_CANDIDATE);
	}

	@Test
	void testDecide_ServerErrorAndRateLimitAreTransient() {
		assertThat(policy.decide(DownloadException.httpStatus(URL, 503), 1, 0).action()).isEqualTo(Action.RETRY);
		assertThat(policy.decide(DownloadException.httpStatus(URL, 429), 1, 0).action()).isEqualTo(Action.RETRY);
	}

	@Test
	void testDecide_ForbiddenRotatesUntilBudgetSpent() {
		// Given
		DownloadException forbidden = DownloadException.httpStatus(URL, 403);

		// When
		Decision first = policy.decide(forbidden, 1, 0);
		Decision exhausted = policy.decide(forbidden, 3, 2);

		// Then
		assertThat(first.action()).isEqualTo(Action.ROTATE_AND_RETRY);
		assertThat(first.delay()).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(5));
		assertThat(exhausted.action()).isEqualTo(Action.NEXT_CANDIDATE);
	}

	@Test
	void testDecide_InvalidContentMovesOn() {
		// When
		Decision decision = policy.decide(DownloadException.invalidContent(URL, "text/html"), 1, 0);

		// Then
		assertThat(decision.action()).isEqualTo(Action.NEXT_CANDIDATE);
	}

	@Test
	void testWithMaxAttempts_SingleAttemptNeverRetries() {
		// Given
		RetryPolicy once = RetryPolicy.withMaxAttempts(1);

		// When
		Decision decision = once.decide(DownloadException.httpStatus(URL, 500), 1, 0);

		// Then
		assertThat(decision.action()).isEqualTo(Action.NEXT_CANDIDATE);
	}
}
