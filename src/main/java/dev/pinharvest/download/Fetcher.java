package dev.pinharvest.download;

/**
 * One way of fetching an image URL. Several fetchers are tried in order for every URL attempt,
 * so adding a backend means adding one entry to the list handed to {@link CandidateDownloader}.
 */
public interface Fetcher {
	String name();

	/**
	 * Fetch a URL.
	 *
	 * @return the body of a 2xx response
	 * @throws DownloadException for timeouts, connection errors and non-2xx statuses
	 */
	FetchResult fetch(String url) throws DownloadException, InterruptedException;

	/** Switch to a fresh set of request headers after the source rejected the current ones */
	default void rotateHeaders() {}
}
