package dev.pinharvest.browser;

import java.util.Map;

/** A network request observed while a page was loading */
public record CapturedRequest(String url, String method, Map<String, String> headers) {}
