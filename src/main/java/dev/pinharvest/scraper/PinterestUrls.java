package dev.pinharvest.scraper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** Pinterest page and API addresses */
public final class PinterestUrls {
	public static final String BASE_URL = "https://www.pinterest.com";

	private PinterestUrls() {}

	public static String searchUrl(String keyword) {
		return BASE_URL + searchPath(keyword);
	}

	public static String searchPath(String keyword) {
		return "/search/pins/?q=" + URLEncoder.encode(keyword, StandardCharsets.UTF_8);
	}

	public static String pinUrl(String pinId) {
		return BASE_URL + "/pin/" + pinId + "/";
	}

	public static boolean isUrl(String keywordOrUrl) {
		String lower = keywordOrUrl.toLowerCase();
		return lower.startsWith("http://") || lower.startsWith("https://");
	}
}
