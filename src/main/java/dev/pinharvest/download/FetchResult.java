package dev.pinharvest.download;

/** A successful (2xx) response body; content checks happen in {@link CandidateDownloader} */
public record FetchResult(String url, byte[] body, String contentType, String fetcher) {}
