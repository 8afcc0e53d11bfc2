package dev.pinharvest.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.pinharvest.browser.BrowserAutomation;
import dev.pinharvest.browser.CapturedRequest;
import dev.pinharvest.util.JsonUtils;
import dev.pinharvest.util.Sleeper;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the search page once and turns one of the search API requests it issued into reusable
 * {@link ApiCredentials}. A request that already carries a pagination bookmark is preferred
 * because it is the one that loads results.
 */
public class CredentialCapture {
	static final String SEARCH_RESOURCE = "BaseSearchResource";
	static final Duration SETTLE = Duration.ofSeconds(2);
	static final int TRIGGER_SCROLLS = 2;

	private static final Logger logger = LoggerFactory.getLogger(CredentialCapture.class);

	private final BrowserAutomation browser;
	private final Sleeper sleeper;

	public CredentialCapture(BrowserAutomation browser, Sleeper sleeper) {
		this.browser = browser;
		this.sleeper = sleeper;
	}

	/**
	 * @throws AcquisitionException if the page doesn't load or no usable request was observed
	 */
	public ApiCredentials capture(String searchUrl) throws AcquisitionException, InterruptedException {
		if (!browser.navigate(searchUrl)) {
			throw new AcquisitionException("Could not load " + searchUrl);
		}
		sleeper.sleep(SETTLE);
		// scrolling makes the page request its second result page, which carries a bookmark
		for (int i = 0; i < TRIGGER_SCROLLS; i++) {
			browser.scroll(BrowserScraper.SCROLL_PIXELS);
			sleeper.sleep(SETTLE);
		}
		ApiCredentials credentials = fromRequests(browser.capturedRequests(), browser.cookies());
		logger.info(
				"Captured API credentials for {} with {} headers and {} cookies",
				credentials.apiUrl(),
				credentials.headers().size(),
				credentials.cookies().size());
		return credentials;
	}

	/**
	 * Pick the newest usable search request and extract its credentials.
	 *
	 * @param browserCookies cookies of the browser context, used when the request carried none
	 */
	static ApiCredentials fromRequests(List<CapturedRequest> requests, Map<String, String> browserCookies)
			throws AcquisitionException {
		List<CapturedRequest> newestFirst = new ArrayList<>(requests);
		Collections.reverse(newestFirst);

		CapturedRequest chosen = null;
		ObjectNode template = null;
		for (boolean requireBookmarks : new boolean[] {true, false}) {
			for (CapturedRequest request : newestFirst) {
				if (!request.url().contains(SEARCH_RESOURCE)
						|| (requireBookmarks && !request.url().contains("bookmarks"))) {
					continue;
				}
				Optional<ObjectNode> data = dataTemplate(request.url());
				if (data.isPresent()) {
					chosen = request;
					template = data.get();
					break;
				}
			}
			if (chosen != null) {
				break;
			}
		}
		if (chosen == null) {
			throw new AcquisitionException("No usable " + SEARCH_RESOURCE + " request was observed");
		}

		String url = chosen.url();
		int query = url.indexOf('?');
		String apiUrl = query >= 0 ? url.substring(0, query) : url;

		Map<String, String> headers = new LinkedHashMap<>();
		Map<String, String> cookies = new LinkedHashMap<>();
		for (Map.Entry<String, String> header : chosen.headers().entrySet()) {
			String name = header.getKey().toLowerCase();
			if (name.equals("cookie")) {
				cookies.putAll(parseCookies(header.getValue()));
			} else if (!name.equals("host")
					&& !name.equals("content-length")
					&& !name.startsWith("x-b3-")
					&& !name.startsWith("sec-ch-")) {
				headers.put(header.getKey(), header.getValue());
			}
		}
		if (cookies.isEmpty() && browserCookies != null) {
			cookies.putAll(browserCookies);
		}
		boolean csrfHeader = headers.keySet().stream().anyMatch(h -> h.equalsIgnoreCase("x-csrftoken"));
		if (!csrfHeader && !cookies.containsKey("csrftoken")) {
			logger.warn("No CSRF token found, API calls will likely be rejected");
		}
		return new ApiCredentials(apiUrl, headers, cookies, template);
	}

	// The data parameter must be a JSON object whose options name a query and a scope
	static Optional<ObjectNode> dataTemplate(String url) {
		String data = queryParameter(url, "data");
		if (data == null) {
			return Optional.empty();
		}
		try {
			JsonNode node = JsonUtils.readTree(data);
			JsonNode options = node.path("options");
			if (node.isObject() && options.isObject() && options.has("query") && options.has("scope")) {
				return Optional.of((ObjectNode) node);
			}
		} catch (IOException e) {
			logger.debug("Ignoring request with unreadable data parameter: {}", e.getMessage());
		}
		return Optional.empty();
	}

	static String queryParameter(String url, String name) {
		int query = url.indexOf('?');
		if (query < 0) {
			return null;
		}
		for (String pair : url.substring(query + 1).split("&")) {
			int eq = pair.indexOf('=');
			String key = eq >= 0 ? pair.substring(0, eq) : pair;
			if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
				return eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
			}
		}
		return null;
	}

	static Map<String, String> parseCookies(String header) {
		Map<String, String> cookies = new LinkedHashMap<>();
		for (String part : header.split(";")) {
			String[] kv = part.trim().split("=", 2);
			if (kv.length == 2) {
				cookies.put(kv[0], kv[1]);
			}
		}
		return cookies;
	}
}
