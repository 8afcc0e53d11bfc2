package dev.pinharvest.download;

import dev.pinharvest.model.DownloadTask;
import dev.pinharvest.model.Pin;
import dev.pinharvest.model.TaskStatus;
import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.PersistenceException;
import dev.pinharvest.store.PinRepository;
import dev.pinharvest.util.CancellationToken;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles the pins of a keyword against the images folder and submits a job for every image
 * that is missing. Pins are read in pages so memory stays bounded, and jobs are handed to the
 * {@link DownloadManager} whose queue blocks this producer when the workers fall behind.
 */
public class DownloadScheduler {
	public static final int PAGE_SIZE = 500;

	private static final Logger logger = LoggerFactory.getLogger(DownloadScheduler.class);

	private final PinRepository repository;
	private final KeywordPartition partition;
	private final DownloadManager downloadManager;
	private final int pageSize;

	public DownloadScheduler(PinRepository repository, KeywordPartition partition, DownloadManager downloadManager) {
		this(repository, partition, downloadManager, PAGE_SIZE);
	}

	public DownloadScheduler(
			PinRepository repository, KeywordPartition partition, DownloadManager downloadManager, int pageSize) {
		this.repository = repository;
		this.partition = partition;
		this.downloadManager = downloadManager;
		this.pageSize = pageSize;
	}

	/**
	 * Counters of one scheduling pass.
	 *
	 * @param scanned pins with at least one image URL
	 * @param present images already on disk
	 * @param queued jobs handed to the download manager
	 * @param healed completed tasks whose file was gone and that were reset to pending
	 * @param failed pins that couldn't be scheduled because of a store error
	 */
	public record Report(int scanned, int present, int queued, int healed, int failed) {
		@Override
		public String toString() {
			return "%d pins scanned, %d images present, %d queued, %d healed, %d failed"
					.formatted(scanned, present, queued, healed, failed);
		}
	}

	public Report schedule() {
		return schedule(new CancellationToken());
	}

	/**
	 * Run one scheduling pass.
	 *
	 * @throws java.util.concurrent.CancellationException if the token is cancelled between pins
	 */
	public Report schedule(CancellationToken cancellation) {
		String keyword = partition.keyword();
		Path imagesDir = partition.imagesDir();
		int scanned = 0, present = 0, queued = 0, healed = 0, failed = 0;
		int offset = 0;
		while (true) {
			List<Pin> page = repository.loadPinsWithImages(keyword, pageSize, offset);
			if (page.isEmpty()) {
				break;
			}
			offset += page.size();
			for (Pin pin : page) {
				cancellation.throwIfCancelled();
				List<String> candidates = CandidateUrls.forPin(pin);
				if (candidates.isEmpty()) {
					continue;
				}
				scanned++;
				String canonicalUrl = candidates.get(0);
				Path target = ImageFiles.expectedPath(imagesDir, pin.id(), canonicalUrl);
				try {
					Optional<DownloadTask> existing = repository.getDownloadTaskByPinAndUrl(pin.id(), canonicalUrl);
					if (ImageFiles.isValidImage(target)) {
						present++;
						recordPresent(pin, canonicalUrl, target, existing);
						continue;
					}
					long taskId;
					if (existing.isPresent()) {
						DownloadTask task = existing.get();
						taskId = task.id();
						if (task.isCompleted()) {
							logger.warn(
									"Anomaly: task {} of pin {} is completed but {}; resetting to pending",
									task.id(),
									pin.id(),
									describeMissing(target));
							repository.updateDownloadTaskStatus(taskId, TaskStatus.PENDING, null, null, null);
							healed++;
						}
					} else {
						taskId = repository.createDownloadTask(pin.id(), canonicalUrl);
					}
					// No new jobs once cancelled, even mid-pin
					cancellation.throwIfCancelled();
					downloadManager.submit(new DownloadJob(taskId, pin.id(), candidates, target));
					queued++;
				} catch (PersistenceException e) {
					failed++;
					logger.error("Failed to schedule download of pin {}: {}", pin.id(), e.getMessage());
				}
			}
			if (page.size() < pageSize) {
				break;
			}
		}
		Report report = new Report(scanned, present, queued, healed, failed);
		logger.info("Scheduled downloads for '{}': {}", keyword, report);
		return report;
	}

	// A file on disk that the store doesn't know about yet still counts as done
	private void recordPresent(Pin pin, String canonicalUrl, Path target, Optional<DownloadTask> existing) {
		if (existing.isPresent() && existing.get().isCompleted() && pin.downloaded()) {
			return;
		}
		long taskId = existing.map(DownloadTask::id).orElseGet(() -> repository.createDownloadTask(pin.id(), canonicalUrl));
		long size;
		try {
			size = Files.size(target);
		} catch (IOException e) {
			size = 0;
		}
		repository.updateDownloadTaskStatus(taskId, TaskStatus.COMPLETED, target.toString(), size, null);
	}

	// Tells an external deletion apart from a write that never finished
	private static String describeMissing(Path target) {
		try {
			if (!Files.exists(target)) {
				return Files.exists(target.resolveSibling(target.getFileName() + ".part"))
						? "only a partial write of " + target + " exists"
						: target + " was deleted";
			}
			return target + " is invalid (" + Files.size(target) + " bytes)";
		} catch (IOException e) {
			return target + " is unreadable";
		}
	}
}
