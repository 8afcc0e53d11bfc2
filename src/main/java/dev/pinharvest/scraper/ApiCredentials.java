package dev.pinharvest.scraper;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What the search API needs to be called outside the browser, taken from one request the page
 * made itself.
 *
 * @param apiUrl resource URL without query string
 * @param headers request headers to replay
 * @param cookies session cookies by name
 * @param dataTemplate the request's {@code data} parameter, with {@code options} to fill in
 */
public record ApiCredentials(
		String apiUrl, Map<String, String> headers, Map<String, String> cookies, ObjectNode dataTemplate) {

	/** Headers plus the Cookie header and the CSRF token when the cookies carry one */
	public Map<String, String> requestHeaders() {
		Map<String, String> all = new LinkedHashMap<>(headers);
		if (!cookies.isEmpty()) {
			all.put(
					"Cookie",
					cookies.entrySet().stream()
							.map(c -> c.getKey() + "=" + c.getValue())
							.collect(Collectors.joining("; ")));
		}
		String csrf = cookies.get("csrftoken");
		if (csrf != null) {
			all.put("X-CSRFToken", csrf);
		}
		return all;
	}
}
