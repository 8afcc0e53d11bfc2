package dev.pinharvest;

import dev.pinharvest.download.DownloadScheduler;

/** Outcome of the download part of a run, or of a download-only run */
public record DownloadSummary(
		String keyword, DownloadScheduler.Report report, int completed, int failed, int deferred) {

	static DownloadSummary none(String keyword) {
		return new DownloadSummary(keyword, new DownloadScheduler.Report(0, 0, 0, 0, 0), 0, 0, 0);
	}

	@Override
	public String toString() {
		return "%s: %s; %d downloaded, %d failed, %d deferred".formatted(keyword, report, completed, failed, deferred);
	}
}
