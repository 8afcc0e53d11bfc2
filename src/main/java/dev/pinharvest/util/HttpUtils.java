package dev.pinharvest.util;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Pooled HTTP client shared by all download workers and the API paginator */
public class HttpUtils implements HttpTransport {

	public static final String DEFAULT_USER_AGENT =
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

	/** Headers a browser sends when loading a pin image */
	public static final Map<String, String> IMAGE_HEADERS = Map.of(
			"User-Agent", DEFAULT_USER_AGENT,
			"Accept", "image/avif,image/webp,image/apng,image/svg+xml,image/*,*/*;q=0.8",
			"Accept-Language", "en-US,en;q=0.9",
			"Referer", "https://www.pinterest.com/",
			"Sec-Fetch-Dest", "image",
			"Sec-Fetch-Mode", "no-cors",
			"Sec-Fetch-Site", "cross-site");

	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	public HttpUtils() {
		this(null);
	}

	/**
	 * @param proxy optional proxy in the form {@code http://host:port}, or null
	 */
	public HttpUtils(String proxy) {
		HttpClient.Builder builder = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30));
		if (proxy != null && !proxy.isBlank()) {
			URI proxyUri = URI.create(proxy.contains("://") ? proxy : "http://" + proxy);
			int port = proxyUri.getPort() > 0 ? proxyUri.getPort() : 8080;
			builder.proxy(ProxySelector.of(new InetSocketAddress(proxyUri.getHost(), port)));
		}
		this.httpClient = builder.build();
	}

	@Override
	public HttpResult get(String url, Map<String, String> headers, Duration timeout)
			throws IOException, InterruptedException {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(timeout != null ? timeout : DEFAULT_TIMEOUT)
				.GET();
		if (headers != null) {
			headers.forEach((name, value) -> {
				if (!isRestrictedHeader(name)) {
					builder.header(name, value);
				}
			});
		}
		HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
		return new HttpResult(
				response.statusCode(), response.body(), new LinkedHashMap<>(response.headers().map()));
	}

	// The JDK client manages these itself and rejects them when set explicitly
	private static boolean isRestrictedHeader(String name) {
		String lower = name.toLowerCase();
		return lower.equals("host")
				|| lower.equals("connection")
				|| lower.equals("content-length")
				|| lower.equals("expect")
				|| lower.equals("upgrade");
	}
}
