package dev.pinharvest.model;

import java.time.Instant;

/** Bookkeeping for one acquisition run of a keyword */
public record ScrapingSession(
		String id,
		String keyword,
		int targetCount,
		String outputDir,
		boolean downloadImages,
		SessionStatus status,
		int savedCount,
		Instant startedAt,
		Instant updatedAt,
		Instant completedAt) {

	public boolean isIncomplete() {
		return status == SessionStatus.RUNNING || status == SessionStatus.INTERRUPTED;
	}
}
