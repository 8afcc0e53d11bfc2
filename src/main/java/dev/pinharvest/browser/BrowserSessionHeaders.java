package dev.pinharvest.browser;

import dev.pinharvest.download.HeaderSource;
import dev.pinharvest.util.HttpUtils;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request headers taken from a real browser session: the browser's User-Agent and the cookies it
 * got from the home page. Captured lazily on first use. A rotation only triggers a new capture
 * once the current one is older than the recapture interval, so a burst of rejections launches
 * at most one browser.
 */
public class BrowserSessionHeaders implements HeaderSource {
	static final String HOME_URL = "https://www.pinterest.com/";
	static final Duration RECAPTURE_INTERVAL = Duration.ofMinutes(5);

	private static final Logger logger = LoggerFactory.getLogger(BrowserSessionHeaders.class);

	private final BrowserFactory browserFactory;
	private final long recaptureNanos;
	private final LongSupplier nanoClock;
	private Map<String, String> headers;
	private long capturedAt;

	public BrowserSessionHeaders(BrowserFactory browserFactory) {
		this(browserFactory, RECAPTURE_INTERVAL, System::nanoTime);
	}

	BrowserSessionHeaders(BrowserFactory browserFactory, Duration recaptureInterval, LongSupplier nanoClock) {
		this.browserFactory = browserFactory;
		this.recaptureNanos = recaptureInterval.toNanos();
		this.nanoClock = nanoClock;
	}

	@Override
	public synchronized Map<String, String> headers() {
		if (headers == null) {
			headers = capture();
			capturedAt = nanoClock.getAsLong();
		}
		return headers;
	}

	@Override
	public synchronized void rotate() {
		if (headers != null && nanoClock.getAsLong() - capturedAt < recaptureNanos) {
			logger.debug("Browser session headers are recent, keeping them");
			return;
		}
		headers = null;
	}

	private Map<String, String> capture() {
		Map<String, String> captured = new LinkedHashMap<>(HttpUtils.IMAGE_HEADERS);
		try (BrowserAutomation browser = browserFactory.open()) {
			if (browser.navigate(HOME_URL)) {
				captured.put("User-Agent", browser.userAgent());
				Map<String, String> cookies = browser.cookies();
				if (!cookies.isEmpty()) {
					captured.put(
							"Cookie",
							cookies.entrySet().stream()
									.map(c -> c.getKey() + "=" + c.getValue())
									.collect(Collectors.joining("; ")));
				}
				logger.debug("Captured browser session headers with {} cookies", cookies.size());
			}
		} catch (BrowserLaunchException e) {
			logger.warn("Browser session unavailable, using default headers: {}", e.getMessage());
		}
		return captured;
	}
}
