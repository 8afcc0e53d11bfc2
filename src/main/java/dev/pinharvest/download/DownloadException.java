package dev.pinharvest.download;

import java.io.IOException;
import java.nio.file.Path;

/** Failure to fetch an image, classified so the retry policy can pick a reaction */
public class DownloadException extends Exception {
	public enum Kind {
		TIMEOUT,
		CONNECTION_FAILED,
		HTTP_STATUS,
		INVALID_CONTENT,
		ALL_CANDIDATES_EXHAUSTED,
		/** The image was fetched but couldn't be stored locally */
		WRITE_FAILED
	}

	private final Kind kind;
	private final int statusCode;
	private final String url;

	private DownloadException(Kind kind, String url, int statusCode, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.url = url;
		this.statusCode = statusCode;
	}

	public static DownloadException timeout(String url, Throwable cause) {
		return new DownloadException(Kind.TIMEOUT, url, -1, "Timed out fetching " + url, cause);
	}

	public static DownloadException connectionFailed(String url, Throwable cause) {
		return new DownloadException(
				Kind.CONNECTION_FAILED, url, -1, "Connection failed for " + url + ": " + cause.getMessage(), cause);
	}

	public static DownloadException httpStatus(String url, int statusCode) {
		return new DownloadException(Kind.HTTP_STATUS, url, statusCode, "HTTP " + statusCode + " for " + url, null);
	}

	public static DownloadException invalidContent(String url, String reason) {
		return new DownloadException(Kind.INVALID_CONTENT, url, -1, "Invalid content from " + url + ": " + reason, null);
	}

	public static DownloadException writeFailed(String url, Path target, IOException cause) {
		return new DownloadException(
				Kind.WRITE_FAILED, url, -1, "Failed to write " + target + ": " + cause.getMessage(), cause);
	}

	/** Every candidate failed; the last failure is the cause */
	public static DownloadException allCandidatesExhausted(String pinId, int candidates, DownloadException last) {
		String detail = last != null ? last.getMessage() : "no candidate URLs";
		return new DownloadException(
				Kind.ALL_CANDIDATES_EXHAUSTED,
				last != null ? last.url() : null,
				last != null ? last.statusCode() : -1,
				"All " + candidates + " candidate URLs failed for pin " + pinId + " (last error: " + detail + ")",
				last);
	}

	public Kind kind() {
		return kind;
	}

	/** HTTP status for {@link Kind#HTTP_STATUS}, otherwise -1 */
	public int statusCode() {
		return statusCode;
	}

	public String url() {
		return url;
	}
}
