package dev.pinharvest.browser;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Rendering browser driven by the scrapers. One instance drives one sequential navigation
 * session and is not shared between threads.
 */
public interface BrowserAutomation extends AutoCloseable {
	/** @return false if the page could not be loaded */
	boolean navigate(String url);

	void scroll(int pixels);

	String getPageSource();

	/** @return false if the selector didn't show up within the timeout */
	boolean waitForSelector(String selector, Duration timeout);

	/** Requests issued by the pages loaded so far, oldest first */
	List<CapturedRequest> capturedRequests();

	/** Cookies of the browser context, by name */
	Map<String, String> cookies();

	String userAgent();

	@Override
	void close();
}
