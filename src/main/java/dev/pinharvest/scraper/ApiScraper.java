package dev.pinharvest.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.pinharvest.browser.BrowserAutomation;
import dev.pinharvest.extract.PinJsonMapper;
import dev.pinharvest.model.Pin;
import dev.pinharvest.util.HttpResult;
import dev.pinharvest.util.HttpTransport;
import dev.pinharvest.util.JsonUtils;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Collects pins through the search API the web page itself uses. Credentials are captured once
 * in the browser, then pages are requested directly with the bookmark of the previous page.
 */
public class ApiScraper extends BaseScraper {
	static final Duration MIN_DELAY = Duration.ofMillis(1000);
	static final Duration MAX_DELAY = Duration.ofMillis(1500);
	static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
	static final int MAX_ATTEMPTS = 3;

	private final BrowserAutomation browser;
	private final HttpTransport transport;
	private final String keyword;
	private final Random random = new Random();

	public ApiScraper(ScraperConfig config, BrowserAutomation browser, HttpTransport transport, String keyword) {
		super(config);
		this.browser = browser;
		this.transport = transport;
		this.keyword = keyword;
	}

	@Override
	public String name() {
		return "api";
	}

	@Override
	protected void scrape() throws AcquisitionException, InterruptedException {
		ApiCredentials credentials =
				new CredentialCapture(browser, sleeper).capture(PinterestUrls.searchUrl(keyword));

		SearchPages pages = new SearchPages(credentials);
		int consumed = 0;
		while (pages.hasNext()) {
			checkCancelled();
			List<Pin> page = pages.next();
			consumed++;
			int added = process(page).size();
			fine("API page " + pages.pagesFetched() + " gave " + added + " new of " + page.size() + " pins");
			if (pages.pagesFetched() > 1 && added == 0) {
				log("No new pins on API page " + pages.pagesFetched() + ", stopping");
				return;
			}
		}
		if (Thread.interrupted()) {
			throw new InterruptedException("Interrupted while fetching API pages");
		}
		if (consumed == 0) {
			if (pages.lastError != null) {
				throw new AcquisitionException(
						"First API page failed: " + pages.lastError.getMessage(), pages.lastError);
			}
			throw new AcquisitionException("First API page returned no pins");
		}
		log("API results exhausted after " + pages.pagesFetched() + " pages");
	}

	/** Build the request URL of one page */
	String pageUrl(ApiCredentials credentials, String bookmark) {
		ObjectNode data = credentials.dataTemplate().deepCopy();
		JsonNode existing = data.get("options");
		ObjectNode options = existing != null && existing.isObject() ? (ObjectNode) existing : data.putObject("options");
		options.put("query", keyword);
		ArrayNode bookmarks = options.putArray("bookmarks");
		if (bookmark != null) {
			bookmarks.add(bookmark);
		}
		return credentials.apiUrl()
				+ "?source_url=" + encode(PinterestUrls.searchPath(keyword))
				+ "&data=" + encode(JsonUtils.toJson(data))
				+ "&_=" + System.currentTimeMillis();
	}

	static List<Pin> parseResults(JsonNode root) {
		List<Pin> pins = new ArrayList<>();
		for (JsonNode result : root.path("resource_response").path("data").path("results")) {
			String type = result.path("type").asText("pin");
			if (!type.equals("pin")) {
				continue;
			}
			Pin pin = PinJsonMapper.toPin(result);
			if (pin != null) {
				pins.add(pin);
			}
		}
		return pins;
	}

	private HttpResult request(String url, ApiCredentials credentials) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
			pause(delay());
			try {
				HttpResult result = transport.get(url, credentials.requestHeaders(), REQUEST_TIMEOUT);
				if (result.isSuccess()) {
					return result;
				}
				lastException = new IOException("API request failed with HTTP status " + result.status());
				if (result.status() < 500 && result.status() != 429) {
					break;
				}
			} catch (IOException e) {
				lastException = e;
			}
			fine("API request attempt " + (attempt + 1) + " failed: " + lastException.getMessage());
		}
		throw lastException;
	}

	private Duration delay() {
		long span = MAX_DELAY.toMillis() - MIN_DELAY.toMillis();
		return MIN_DELAY.plusMillis((long) (random.nextDouble() * span));
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private class SearchPages extends BookmarkIterator<Pin> {
		private final ApiCredentials credentials;
		private Exception lastError;

		SearchPages(ApiCredentials credentials) {
			this.credentials = credentials;
		}

		@Override
		protected Page<Pin> fetchPage(String bookmark) throws Exception {
			HttpResult result = request(pageUrl(credentials, bookmark), credentials);
			JsonNode root = JsonUtils.readTree(new String(result.body(), StandardCharsets.UTF_8));
			String next = root.path("resource_response").path("bookmark").asText(null);
			return new Page<>(parseResults(root), next);
		}

		@Override
		protected void handleFetchError(Exception e) {
			if (e instanceof CancellationException) {
				throw (CancellationException) e;
			}
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			lastError = e;
			warn("Failed to fetch API page: " + e.getMessage());
		}
	}
}
