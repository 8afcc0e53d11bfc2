package dev.pinharvest.download;

import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.testing.StubTransport;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpFetcherTest {
	private static final String URL = "https://i.pinimg.com/originals/aa/p1.jpg";

	private final StubTransport transport = new StubTransport();
	private final RotatingHeaders headers = new RotatingHeaders();
	private final HttpFetcher fetcher = new HttpFetcher("pooled", transport, headers, Duration.ofSeconds(5));

	@Test
	void testFetch_Success() throws Exception {
		// Given
		transport.image(URL);

		// When
		FetchResult result = fetcher.fetch(URL);

		// Then
		assertThat(result.contentType()).isEqualTo("image/jpeg");
		assertThat(result.body()).hasSize(2048);
		assertThat(result.fetcher()).isEqualTo("pooled");
	}

	@Test
	void testFetch_StatusBecomesDownloadException() {
		// Given
		transport.on(URL, (url, h) -> StubTransport.status(404));

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(URL))
				.isInstanceOfSatisfying(DownloadException.class, e -> {
					assertThat(e.kind()).isEqualTo(DownloadException.Kind.HTTP_STATUS);
					assertThat(e.statusCode()).isEqualTo(404);
				});
	}

	@Test
	void testFetch_Timeout() {
		// Given
		transport.on(URL, (url, h) -> {
			throw new HttpTimeoutException("request timed out");
		});

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(URL))
				.isInstanceOfSatisfying(DownloadException.class, e -> assertThat(e.kind())
						.isEqualTo(DownloadException.Kind.TIMEOUT));
	}

	@Test
	void testFetch_ConnectionFailure() {
		// Given
		transport.on(URL, (url, h) -> {
			throw new ConnectException("refused");
		});

		// When/Then
		assertThatThrownBy(() -> fetcher.fetch(URL))
				.isInstanceOfSatisfying(DownloadException.class, e -> assertThat(e.kind())
						.isEqualTo(DownloadException.Kind.CONNECTION_FAILED));
	}

	@Test
	void testRotateHeaders_ChangesUserAgent() throws Exception {
		// Given
		List<Map<String, String>> sent = new ArrayList<>();
		transport.on(URL, (url, h) -> {
			sent.add(h);
			return StubTransport.ok(new byte[] {1}, "image/jpeg");
		});

		// When
		fetcher.fetch(URL);
		fetcher.rotateHeaders();
		fetcher.fetch(URL);

		// Then
		assertThat(sent.get(0).get("User-Agent")).isNotEqualTo(sent.get(1).get("User-Agent"));
		assertThat(sent.get(1).get("User-Agent")).isEqualTo(RotatingHeaders.USER_AGENTS.get(1));
	}
}
