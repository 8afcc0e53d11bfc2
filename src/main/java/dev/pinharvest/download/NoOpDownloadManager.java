package dev.pinharvest.download;

import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DownloadManager used when image downloads are switched off. Jobs are dropped, which leaves
 * their tasks pending for a later {@code download} run.
 */
public class NoOpDownloadManager implements DownloadManager {
	private static final Logger logger = LoggerFactory.getLogger(NoOpDownloadManager.class);

	private final AtomicInteger deferred = new AtomicInteger(0);

	@Override
	public void start() {
		logger.info("Image downloads disabled - download tasks stay pending");
	}

	@Override
	public void submit(DownloadJob job) {
		deferred.incrementAndGet();
		logger.debug("Deferring download of pin {} (task {})", job.pinId(), job.taskId());
	}

	@Override
	public void shutdown() {
		logger.info("Deferred {} downloads", deferred.get());
	}

	@Override
	public void cancel() {
		// Nothing is running
	}

	@Override
	public void awaitCompletion() {
		// No-op - nothing to wait for
	}

	@Override
	public int getCompletedCount() {
		return 0;
	}

	@Override
	public int getFailedCount() {
		return 0;
	}

	/** Number of jobs that were skipped */
	public int getDeferredCount() {
		return deferred.get();
	}
}
