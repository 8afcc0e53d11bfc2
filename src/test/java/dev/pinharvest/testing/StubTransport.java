package dev.pinharvest.testing;

import dev.pinharvest.util.HttpResult;
import dev.pinharvest.util.HttpTransport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Scripted {@link HttpTransport}. Unknown URLs answer 404; every request is recorded. */
public class StubTransport implements HttpTransport {

	@FunctionalInterface
	public interface Handler {
		HttpResult handle(String url, Map<String, String> headers) throws IOException;
	}

	private final Map<String, Handler> handlers = new ConcurrentHashMap<>();
	private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
	private Handler fallback = (url, headers) -> status(404);

	public StubTransport on(String url, Handler handler) {
		handlers.put(url, handler);
		return this;
	}

	/** Handler for URLs without their own handler */
	public StubTransport otherwise(Handler handler) {
		this.fallback = handler;
		return this;
	}

	public StubTransport image(String url) {
		return on(url, (u, h) -> ok(TestPins.jpeg(), "image/jpeg"));
	}

	@Override
	public HttpResult get(String url, Map<String, String> headers, Duration timeout) throws IOException {
		requests.add(url);
		return handlers.getOrDefault(url, fallback).handle(url, headers);
	}

	public List<String> requests() {
		synchronized (requests) {
			return new ArrayList<>(requests);
		}
	}

	public long requestsTo(String url) {
		return requests().stream().filter(url::equals).count();
	}

	public static HttpResult ok(byte[] body, String contentType) {
		return new HttpResult(200, body, Map.of("Content-Type", List.of(contentType)));
	}

	public static HttpResult json(String body) {
		return ok(body.getBytes(StandardCharsets.UTF_8), "application/json");
	}

	public static HttpResult status(int status) {
		return new HttpResult(status, new byte[0], Map.of());
	}
}
