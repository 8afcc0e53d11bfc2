package dev.pinharvest.util;

import static org.assertj.core.api.Assertions.*;

import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

	@Test
	void testCancel_OnlyFirstCallWins() {
		// Given
		CancellationToken token = new CancellationToken();

		// When
		boolean first = token.cancel();
		boolean second = token.cancel();

		// Then
		assertThat(first).isTrue();
		assertThat(second).isFalse();
		assertThat(token.isCancelled()).isTrue();
	}

	@Test
	void testThrowIfCancelled() {
		// Given
		CancellationToken token = new CancellationToken();

		// When/Then
		assertThatCode(token::throwIfCancelled).doesNotThrowAnyException();
		token.cancel();
		assertThatThrownBy(token::throwIfCancelled).isInstanceOf(CancellationException.class);
	}
}
