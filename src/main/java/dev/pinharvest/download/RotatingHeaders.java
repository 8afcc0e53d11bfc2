package dev.pinharvest.download;

import dev.pinharvest.util.HttpUtils;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Static browser-like headers whose User-Agent cycles through a fixed list on rotation */
public class RotatingHeaders implements HeaderSource {
	static final List<String> USER_AGENTS = List.of(
			HttpUtils.DEFAULT_USER_AGENT,
			"Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
			"Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 Firefox/125.0");

	private final Map<String, String> base;
	private final AtomicInteger index = new AtomicInteger();

	public RotatingHeaders() {
		this(HttpUtils.IMAGE_HEADERS);
	}

	public RotatingHeaders(Map<String, String> base) {
		this.base = Map.copyOf(base);
	}

	@Override
	public Map<String, String> headers() {
		Map<String, String> headers = new LinkedHashMap<>(base);
		headers.put("User-Agent", USER_AGENTS.get(Math.floorMod(index.get(), USER_AGENTS.size())));
		return headers;
	}

	@Override
	public void rotate() {
		index.incrementAndGet();
	}
}
