package dev.pinharvest.download;

import dev.pinharvest.util.FileUtils;
import dev.pinharvest.util.Sleeper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the candidate URLs of one pin strictly in order and stops at the first URL that yields an
 * image. Every attempt on a URL runs the fetchers in order; the {@link RetryPolicy} decides
 * whether a failed attempt is repeated or the next candidate is tried.
 */
public class CandidateDownloader {
	private static final Logger logger = LoggerFactory.getLogger(CandidateDownloader.class);

	private final List<Fetcher> fetchers;
	private final RetryPolicy retryPolicy;
	private final Sleeper sleeper;

	public CandidateDownloader(List<Fetcher> fetchers, RetryPolicy retryPolicy, Sleeper sleeper) {
		if (fetchers.isEmpty()) {
			throw new IllegalArgumentException("At least one fetcher is required");
		}
		this.fetchers = List.copyOf(fetchers);
		this.retryPolicy = retryPolicy;
		this.sleeper = sleeper;
	}

	/** Where and from which URL an image was stored */
	public record Downloaded(String url, Path path, long size) {}

	public Downloaded download(DownloadJob job) throws DownloadException, InterruptedException {
		DownloadException last = null;
		for (String url : job.candidates()) {
			int attempts = 0;
			int forbiddenRetries = 0;
			List<Fetcher> forbidden = new ArrayList<>();
			while (true) {
				attempts++;
				forbidden.clear();
				try {
					FetchResult result = attempt(url, forbidden);
					FileUtils.writeAtomically(job.target(), result.body());
					logger.debug(
							"Stored {} from {} via {} ({} bytes)", job.target(), url, result.fetcher(), result.body().length);
					return new Downloaded(url, job.target(), result.body().length);
				} catch (DownloadException e) {
					last = e;
					RetryPolicy.Decision decision = retryPolicy.decide(e, attempts, forbiddenRetries);
					if (decision.action() == RetryPolicy.Action.NEXT_CANDIDATE) {
						logger.debug("Giving up on {} after {} attempt(s): {}", url, attempts, e.getMessage());
						break;
					}
					if (decision.action() == RetryPolicy.Action.ROTATE_AND_RETRY) {
						forbiddenRetries++;
						forbidden.forEach(Fetcher::rotateHeaders);
					}
					logger.debug("Retrying {} in {} ms: {}", url, decision.delay().toMillis(), e.getMessage());
					sleeper.sleep(decision.delay());
				} catch (IOException e) {
					// A local disk failure ends the job
					throw DownloadException.writeFailed(url, job.target(), e);
				}
			}
		}
		throw DownloadException.allCandidatesExhausted(job.pinId(), job.candidates().size(), last);
	}

	// One attempt runs the fetchers in order; a 404 means the URL is gone whoever asks.
	// Fetchers answered with a 403 are added to forbidden.
	private FetchResult attempt(String url, List<Fetcher> forbidden) throws DownloadException, InterruptedException {
		DownloadException last = null;
		for (Fetcher fetcher : fetchers) {
			try {
				FetchResult result = fetcher.fetch(url);
				validate(result);
				return result;
			} catch (DownloadException e) {
				last = e;
				if (e.kind() == DownloadException.Kind.HTTP_STATUS && e.statusCode() == 404) {
					throw e;
				}
				if (e.kind() == DownloadException.Kind.HTTP_STATUS && e.statusCode() == 403) {
					forbidden.add(fetcher);
				}
				logger.trace("Fetcher {} failed for {}: {}", fetcher.name(), url, e.getMessage());
			}
		}
		throw last;
	}

	/**
	 * Reject bodies that {@link ImageFiles#isValidImage(Path)} wouldn't accept once stored, such as
	 * HTML interstitials served with a 200 status.
	 */
	static void validate(FetchResult result) throws DownloadException {
		byte[] body = result.body();
		if (body == null || body.length == 0) {
			throw DownloadException.invalidContent(result.url(), "empty body");
		}
		String type = result.contentType() != null ? result.contentType().toLowerCase(Locale.ROOT) : "";
		boolean imageType = type.startsWith("image/") || type.isEmpty() || type.contains("octet-stream");
		if (!imageType) {
			throw DownloadException.invalidContent(result.url(), "content type " + type);
		}
		if (ImageFiles.detectFormat(body).isEmpty()) {
			throw DownloadException.invalidContent(result.url(), "not a known image format");
		}
		if (body.length < ImageFiles.MIN_SIZE) {
			throw DownloadException.invalidContent(result.url(), "only " + body.length + " bytes");
		}
	}
}
