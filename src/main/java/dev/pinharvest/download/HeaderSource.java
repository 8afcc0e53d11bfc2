package dev.pinharvest.download;

import java.util.Map;

/** Supplies the request headers of a {@link Fetcher} */
public interface HeaderSource {
	Map<String, String> headers();

	void rotate();
}
