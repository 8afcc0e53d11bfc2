package dev.pinharvest.download;

/**
 * Consumes scheduled download jobs. Implementations receive jobs from the {@link
 * DownloadScheduler} and record the outcome of each on its persisted task.
 */
public interface DownloadManager {
	/**
	 * Submit a job, blocking while the work queue is full.
	 *
	 * @param job The job to run
	 */
	void submit(DownloadJob job);

	/**
	 * Start the download manager. Should be called once after construction.
	 */
	void start();

	/**
	 * Signal that no more jobs will be submitted. Queued jobs still run.
	 */
	void shutdown();

	/**
	 * Drop queued jobs and interrupt running ones. Their tasks go back to pending.
	 */
	void cancel();

	/**
	 * Wait for all queued downloads to complete. This method blocks until all downloads are
	 * finished.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	void awaitCompletion() throws InterruptedException;

	/**
	 * Get the number of completed downloads.
	 *
	 * @return Number of successfully completed downloads
	 */
	int getCompletedCount();

	/**
	 * Get the number of failed downloads.
	 *
	 * @return Number of failed downloads
	 */
	int getFailedCount();
}
