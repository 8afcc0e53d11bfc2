package dev.pinharvest.browser;

import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.testing.FakeBrowser;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class BrowserSessionHeadersTest {

	private final FakeBrowser browser = new FakeBrowser();
	private final AtomicInteger opened = new AtomicInteger();
	private final AtomicLong now = new AtomicLong();
	private final BrowserSessionHeaders headers =
			new BrowserSessionHeaders(browser.factory(opened), Duration.ofMinutes(5), now::get);

	@Test
	void testHeaders_CapturedOnceFromBrowser() {
		// Given
		browser.cookies.put("csrftoken", "abc");
		browser.cookies.put("_pinterest_sess", "xyz");

		// When
		Map<String, String> first = headers.headers();
		Map<String, String> second = headers.headers();

		// Then
		assertThat(opened.get()).isEqualTo(1);
		assertThat(second).isSameAs(first);
		assertThat(first).containsEntry("User-Agent", "FakeBrowser/1.0");
		assertThat(first).containsEntry("Cookie", "csrftoken=abc; _pinterest_sess=xyz");
		assertThat(browser.navigations).containsExactly(BrowserSessionHeaders.HOME_URL);
		assertThat(browser.closed).isTrue();
	}

	@Test
	void testRotate_BurstKeepsRecentCapture() {
		// Given
		headers.headers();

		// When
		for (int i = 0; i < 10; i++) {
			now.addAndGet(Duration.ofSeconds(1).toNanos());
			headers.rotate();
			headers.headers();
		}

		// Then
		assertThat(opened.get()).isEqualTo(1);
	}

	@Test
	void testRotate_RecapturesAfterInterval() {
		// Given
		headers.headers();
		now.addAndGet(Duration.ofMinutes(6).toNanos());

		// When
		headers.rotate();
		headers.headers();

		// Then
		assertThat(opened.get()).isEqualTo(2);
	}
}
