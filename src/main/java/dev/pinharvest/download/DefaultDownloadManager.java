package dev.pinharvest.download;

import dev.pinharvest.model.TaskStatus;
import dev.pinharvest.reporting.ProgressEvent;
import dev.pinharvest.reporting.ProgressReporter;
import dev.pinharvest.store.PersistenceException;
import dev.pinharvest.store.PinRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation that runs a fixed pool of download workers. Jobs arrive on a bounded
 * queue; each worker polls it with a short timeout so it notices shutdown promptly, holds one
 * permit of a pool-wide semaphore while a job runs, and records the outcome on the persisted task.
 */
public class DefaultDownloadManager implements DownloadManager {
	public static final int DEFAULT_WORKERS = 15;
	private static final int QUEUE_CAPACITY_PER_WORKER = 4;
	private static final long POLL_TIMEOUT_MILLIS = 500;

	private static final Logger logger = LoggerFactory.getLogger(DefaultDownloadManager.class);

	private final int workerCount;
	private final BlockingQueue<DownloadJob> downloadQueue;
	private final ExecutorService executorService;
	private final Semaphore permits;
	private final PinRepository repository;
	private final CandidateDownloader downloader;
	private final ProgressReporter reporter;
	private final String stage;
	private final AtomicInteger activeDownloads;
	private final AtomicInteger completedDownloads;
	private final AtomicInteger failedDownloads;
	private volatile boolean shutdownRequested;
	private volatile boolean cancelled;

	/**
	 * Create a new DefaultDownloadManager.
	 *
	 * @param workerCount Number of parallel download workers
	 * @param repository Store of the keyword whose tasks are processed
	 * @param downloader Resolves the candidate URLs of a job
	 * @param reporter Progress channel, or null for log output only
	 * @param stage Name of this pool in progress events
	 */
	public DefaultDownloadManager(
			int workerCount,
			PinRepository repository,
			CandidateDownloader downloader,
			ProgressReporter reporter,
			String stage) {
		if (workerCount < 1) {
			throw new IllegalArgumentException("At least one download worker is required");
		}
		this.workerCount = workerCount;
		this.downloadQueue = new ArrayBlockingQueue<>(workerCount * QUEUE_CAPACITY_PER_WORKER);
		this.executorService = Executors.newFixedThreadPool(workerCount);
		this.permits = new Semaphore(workerCount);
		this.repository = repository;
		this.downloader = downloader;
		this.reporter = reporter;
		this.stage = stage;
		this.activeDownloads = new AtomicInteger(0);
		this.completedDownloads = new AtomicInteger(0);
		this.failedDownloads = new AtomicInteger(0);
		this.shutdownRequested = false;
	}

	/**
	 * Start the download worker threads. Should be called once after construction.
	 */
	@Override
	public void start() {
		logger.info("Starting DownloadManager with {} workers", workerCount);
		for (int i = 0; i < workerCount; i++) {
			executorService.submit(this::downloadWorker);
		}
	}

	/**
	 * @throws CancellationException if the manager was cancelled before or while the job waited for
	 *     room in the queue
	 * @throws IllegalStateException if {@link #shutdown()} was called
	 */
	@Override
	public void submit(DownloadJob job) {
		checkNotCancelled();
		if (shutdownRequested) {
			throw new IllegalStateException("Cannot submit downloads after shutdown requested");
		}
		try {
			// Workers are gone after a cancel, so keep re-checking while the queue is full
			while (!downloadQueue.offer(job, POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
				checkNotCancelled();
			}
			checkNotCancelled();
			logger.debug("Queued download for pin {} ({} candidates)", job.pinId(), job.candidates().size());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			CancellationException cancellation = new CancellationException("Interrupted while submitting download");
			cancellation.initCause(e);
			throw cancellation;
		}
	}

	private void checkNotCancelled() {
		if (cancelled) {
			throw new CancellationException("Downloads were cancelled");
		}
	}

	@Override
	public void shutdown() {
		logger.debug("No more downloads will be submitted");
		shutdownRequested = true;
	}

	@Override
	public void cancel() {
		cancelled = true;
		shutdownRequested = true;
		List<DownloadJob> dropped = new ArrayList<>();
		downloadQueue.drainTo(dropped);
		executorService.shutdownNow();
		logger.info("Cancelled downloads, dropped {} queued jobs", dropped.size());
	}

	/**
	 * Wait for all queued downloads to complete. This method blocks until all downloads are
	 * finished.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	@Override
	public void awaitCompletion() throws InterruptedException {
		while (!downloadQueue.isEmpty() || activeDownloads.get() > 0) {
			Thread.sleep(100);
		}
		executorService.shutdown();
		executorService.awaitTermination(1, TimeUnit.HOURS);
	}

	@Override
	public int getCompletedCount() {
		return completedDownloads.get();
	}

	@Override
	public int getFailedCount() {
		return failedDownloads.get();
	}

	/**
	 * Get the number of downloads currently in progress.
	 *
	 * @return Number of active downloads
	 */
	public int getActiveCount() {
		return activeDownloads.get();
	}

	/** Worker thread that processes downloads from the queue */
	private void downloadWorker() {
		while (!shutdownRequested || !downloadQueue.isEmpty()) {
			try {
				DownloadJob job = downloadQueue.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
				if (job == null) {
					continue;
				}
				permits.acquire();
				activeDownloads.incrementAndGet();
				try {
					processDownload(job);
				} finally {
					activeDownloads.decrementAndGet();
					permits.release();
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
		}
	}

	/** Run one job and record its outcome; only interruption escapes */
	private void processDownload(DownloadJob job) throws InterruptedException {
		try {
			repository.updateDownloadTaskStatus(job.taskId(), TaskStatus.DOWNLOADING, null, null, null);
		} catch (PersistenceException e) {
			failedDownloads.incrementAndGet();
			logger.error("Failed to mark task {} as downloading: {}", job.taskId(), e.getMessage());
			return;
		}
		try {
			CandidateDownloader.Downloaded result = downloader.download(job);
			repository.updateDownloadTaskStatus(
					job.taskId(), TaskStatus.COMPLETED, result.path().toString(), result.size(), null);
			int done = completedDownloads.incrementAndGet();
			report(ProgressEvent.progress(stage, "pin " + job.pinId() + " saved (" + done + " done)"));
		} catch (DownloadException e) {
			markFailed(job, e.getMessage());
			logger.warn("Download failed for pin {}: {}", job.pinId(), e.getMessage());
		} catch (InterruptedException e) {
			repository.updateDownloadTaskStatus(job.taskId(), TaskStatus.PENDING, null, null, null);
			throw e;
		} catch (RuntimeException e) {
			markFailed(job, e.toString());
			logger.error("Unexpected error downloading pin {}", job.pinId(), e);
		}
	}

	private void markFailed(DownloadJob job, String message) {
		failedDownloads.incrementAndGet();
		try {
			repository.updateDownloadTaskStatus(job.taskId(), TaskStatus.FAILED, null, null, message);
		} catch (PersistenceException e) {
			logger.error("Failed to record failure of task {}: {}", job.taskId(), e.getMessage());
		}
	}

	private void report(ProgressEvent event) {
		if (reporter != null) {
			reporter.report(event);
		}
	}
}
