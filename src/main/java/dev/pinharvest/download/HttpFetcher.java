package dev.pinharvest.download;

import dev.pinharvest.util.HttpResult;
import dev.pinharvest.util.HttpTransport;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/** {@link Fetcher} over an {@link HttpTransport} with headers from a {@link HeaderSource} */
public class HttpFetcher implements Fetcher {
	private final String name;
	private final HttpTransport transport;
	private final HeaderSource headers;
	private final Duration timeout;

	public HttpFetcher(String name, HttpTransport transport, HeaderSource headers, Duration timeout) {
		this.name = name;
		this.transport = transport;
		this.headers = headers;
		this.timeout = timeout;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public FetchResult fetch(String url) throws DownloadException, InterruptedException {
		HttpResult result;
		try {
			result = transport.get(url, headers.headers(), timeout);
		} catch (HttpTimeoutException e) {
			throw DownloadException.timeout(url, e);
		} catch (IOException e) {
			throw DownloadException.connectionFailed(url, e);
		}
		if (!result.isSuccess()) {
			throw DownloadException.httpStatus(url, result.status());
		}
		return new FetchResult(url, result.body(), result.contentType().orElse(null), name);
	}

	@Override
	public void rotateHeaders() {
		headers.rotate();
	}
}
