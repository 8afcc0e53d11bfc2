package dev.pinharvest.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Status, body and headers of a completed HTTP exchange */
public record HttpResult(int status, byte[] body, Map<String, List<String>> headers) {

	public boolean isSuccess() {
		return status >= 200 && status < 300;
	}

	/** Case-insensitive lookup of the first value of a header */
	public Optional<String> header(String name) {
		for (var entry : headers.entrySet()) {
			if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
				return entry.getValue().stream().findFirst();
			}
		}
		return Optional.empty();
	}

	public Optional<String> contentType() {
		return header("Content-Type");
	}
}
