package dev.pinharvest.model;

/**
 * One persisted obligation to fetch the image of a pin. The image URL is the canonical
 * (highest resolution) candidate; fallbacks are recomputed from the pin when the task runs.
 */
public record DownloadTask(
		long id,
		String pinId,
		String imageUrl,
		TaskStatus status,
		String localPath,
		Long fileSize,
		String errorMessage,
		int retryCount) {

	public boolean isCompleted() {
		return status == TaskStatus.COMPLETED;
	}
}
