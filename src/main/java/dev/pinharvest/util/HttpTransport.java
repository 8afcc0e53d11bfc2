package dev.pinharvest.util;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Minimal HTTP client used by the download pipeline and the API paginator. Non-2xx responses are
 * returned, not thrown; timeouts surface as {@link java.net.http.HttpTimeoutException}.
 */
public interface HttpTransport {
	HttpResult get(String url, Map<String, String> headers, Duration timeout) throws IOException, InterruptedException;
}
