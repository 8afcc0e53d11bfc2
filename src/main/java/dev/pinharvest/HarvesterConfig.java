package dev.pinharvest;

import dev.pinharvest.download.DefaultDownloadManager;
import dev.pinharvest.download.RetryPolicy;
import dev.pinharvest.scraper.RelatedPinsScraper;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of a harvester, shared by every keyword it runs.
 *
 * @param outputDir root of all keyword partitions
 * @param proxy proxy server for the browser and the HTTP client, or null
 * @param downloadImages false keeps every download task pending
 * @param headless false shows the browser window
 * @param apiMode use the search API instead of scrolling for the first phase
 * @param downloadWorkers size of the download pool
 * @param maxFailures failed pins after which a phase is aborted, 0 for no limit
 * @param maxPerSeed new pins drawn from one seed during related expansion
 * @param downloadTimeout timeout of one image request
 * @param maxDownloadAttempts attempts per candidate URL for transient errors
 * @param maxForbiddenRetries retries per candidate URL after a 403
 */
public record HarvesterConfig(
		Path outputDir,
		String proxy,
		boolean downloadImages,
		boolean headless,
		boolean apiMode,
		int downloadWorkers,
		int maxFailures,
		int maxPerSeed,
		Duration downloadTimeout,
		int maxDownloadAttempts,
		int maxForbiddenRetries) {

	public static final int DEFAULT_MAX_FAILURES = 10;
	public static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofSeconds(30);

	public static HarvesterConfig defaults(Path outputDir) {
		return new HarvesterConfig(
				outputDir,
				null,
				true,
				true,
				false,
				DefaultDownloadManager.DEFAULT_WORKERS,
				DEFAULT_MAX_FAILURES,
				RelatedPinsScraper.DEFAULT_MAX_PER_SEED,
				DEFAULT_DOWNLOAD_TIMEOUT,
				RetryPolicy.defaults().maxAttempts(),
				RetryPolicy.defaults().maxForbiddenRetries());
	}

	public HarvesterConfig withDownloadImages(boolean downloadImages) {
		return new HarvesterConfig(
				outputDir,
				proxy,
				downloadImages,
				headless,
				apiMode,
				downloadWorkers,
				maxFailures,
				maxPerSeed,
				downloadTimeout,
				maxDownloadAttempts,
				maxForbiddenRetries);
	}

	public HarvesterConfig withDownloadWorkers(int downloadWorkers) {
		return new HarvesterConfig(
				outputDir,
				proxy,
				downloadImages,
				headless,
				apiMode,
				downloadWorkers,
				maxFailures,
				maxPerSeed,
				downloadTimeout,
				maxDownloadAttempts,
				maxForbiddenRetries);
	}

	public HarvesterConfig withProxy(String proxy) {
		return new HarvesterConfig(
				outputDir,
				proxy,
				downloadImages,
				headless,
				apiMode,
				downloadWorkers,
				maxFailures,
				maxPerSeed,
				downloadTimeout,
				maxDownloadAttempts,
				maxForbiddenRetries);
	}

	public RetryPolicy retryPolicy() {
		RetryPolicy base = RetryPolicy.withMaxAttempts(maxDownloadAttempts);
		return new RetryPolicy(
				maxDownloadAttempts,
				maxForbiddenRetries,
				base.initialBackoff(),
				base.maxBackoff(),
				base.forbiddenMinBackoff(),
				base.forbiddenMaxBackoff());
	}
}
