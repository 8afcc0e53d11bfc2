package dev.pinharvest.store;

import dev.pinharvest.lock.ProcessLock;
import dev.pinharvest.model.Pin;
import dev.pinharvest.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges every keyword store of one output tree into another. The receiving tree wins: a pin whose
 * id it already holds is skipped, never overwritten. New pins are inserted in batches together
 * with their downloaded image when the receiving tree doesn't have that file yet.
 */
public class PartitionMerger {
	public static final int BATCH_SIZE = 100;

	private static final Logger logger = LoggerFactory.getLogger(PartitionMerger.class);

	private final Path sourceDir;
	private final Path targetDir;
	private final boolean dryRun;
	private final ProcessLock lock;

	/**
	 * @param sourceDir output tree receiving the pins
	 * @param targetDir output tree whose pins are merged in
	 * @param dryRun only count what would be merged
	 * @param lock keyword locks of the receiving tree
	 */
	public PartitionMerger(Path sourceDir, Path targetDir, boolean dryRun, ProcessLock lock) {
		this.sourceDir = sourceDir;
		this.targetDir = targetDir;
		this.dryRun = dryRun;
		this.lock = lock;
	}

	/**
	 * Totals of a merge.
	 *
	 * @param keywords keywords that were processed
	 * @param pinsProcessed pins read from the merged tree
	 * @param pinsMerged pins inserted (or, in a dry run, that would be)
	 * @param pinsSkipped pins the receiving tree already had
	 * @param imagesCopied image files copied over
	 * @param errors keywords or batches that failed
	 */
	public record MergeStats(
			int keywords,
			int pinsProcessed,
			int pinsMerged,
			int pinsSkipped,
			int imagesCopied,
			int errors,
			List<String> errorDetails) {

		@Override
		public String toString() {
			return "%d keywords, %d pins processed, %d merged, %d skipped, %d images copied, %d errors"
					.formatted(keywords, pinsProcessed, pinsMerged, pinsSkipped, imagesCopied, errors);
		}
	}

	private static class Counters {
		int keywords;
		int pinsProcessed;
		int pinsMerged;
		int pinsSkipped;
		int imagesCopied;
		final List<String> errors = new ArrayList<>();

		MergeStats toStats() {
			return new MergeStats(
					keywords, pinsProcessed, pinsMerged, pinsSkipped, imagesCopied, errors.size(), List.copyOf(errors));
		}
	}

	public MergeStats mergeAll() throws IOException {
		Counters counters = new Counters();
		List<Path> partitions = KeywordPartition.findPartitionDirectories(targetDir);
		logger.info("Found {} keyword stores to merge from {}", partitions.size(), targetDir);
		for (Path partitionDir : partitions) {
			List<String> keywords;
			try (SqlitePinRepository target =
					new SqlitePinRepository(partitionDir.resolve(KeywordPartition.DATABASE_FILE))) {
				keywords = target.getKeywords();
				for (String keyword : keywords) {
					KeywordPartition receiving = new KeywordPartition(
							keyword, sourceDir, partitionDir.getFileName().toString());
					mergeKeyword(target, receiving, counters);
				}
			} catch (PersistenceException e) {
				error(counters, "Failed to read " + partitionDir + ": " + e.getMessage());
			}
		}
		MergeStats stats = counters.toStats();
		logger.info("{}merge finished: {}", dryRun ? "Dry-run " : "", stats);
		return stats;
	}

	private void mergeKeyword(PinRepository target, KeywordPartition receiving, Counters counters) {
		String keyword = receiving.keyword();
		counters.keywords++;
		List<Pin> pins = target.loadPinsByQuery(keyword, null, 0);
		if (pins.isEmpty()) {
			logger.info("Nothing to merge for '{}'", keyword);
			return;
		}
		boolean exists = Files.exists(receiving.databaseFile());
		if (dryRun) {
			Set<String> existing = Set.of();
			if (exists) {
				try (SqlitePinRepository source = SqlitePinRepository.open(receiving)) {
					existing = source.getPinIds(keyword);
				}
			}
			for (Pin pin : pins) {
				counters.pinsProcessed++;
				if (existing.contains(pin.id())) {
					counters.pinsSkipped++;
				} else {
					counters.pinsMerged++;
				}
			}
			logger.info(
					"'{}' would {} {} pins",
					keyword,
					exists ? "merge into the existing store" : "create a store with",
					pins.size());
			return;
		}

		if (!lock.acquire(receiving.lockName())) {
			error(counters, "Keyword '" + keyword + "' is locked by another process");
			return;
		}
		try (SqlitePinRepository source = SqlitePinRepository.open(receiving)) {
			Set<String> existing = source.getPinIds(keyword);
			List<Pin> toMerge = new ArrayList<>();
			for (Pin pin : pins) {
				counters.pinsProcessed++;
				if (existing.contains(pin.id())) {
					counters.pinsSkipped++;
				} else {
					toMerge.add(pin);
				}
			}
			for (int i = 0; i < toMerge.size(); i += BATCH_SIZE) {
				List<Pin> batch = toMerge.subList(i, Math.min(i + BATCH_SIZE, toMerge.size()));
				for (Pin pin : batch) {
					copyImage(pin, receiving, counters);
				}
				try {
					counters.pinsMerged += source.insertPinsIfAbsent(batch, keyword);
				} catch (PersistenceException e) {
					error(counters, "Failed to save a batch of " + batch.size() + " pins for '" + keyword + "': "
							+ e.getMessage());
				}
			}
			logger.info("Merged {} new pins into '{}' ({} already present)", toMerge.size(), keyword, existing.size());
		} finally {
			lock.release(receiving.lockName());
		}
	}

	// The merged pin points at the copy so the receiving tree is self-contained
	private void copyImage(Pin pin, KeywordPartition receiving, Counters counters) {
		if (!pin.downloaded() || pin.downloadPath() == null) {
			return;
		}
		Path image = Path.of(pin.downloadPath());
		if (!Files.isRegularFile(image)) {
			pin.downloaded(false).downloadPath(null);
			return;
		}
		Path copy = receiving.imagesDir().resolve(image.getFileName());
		try {
			if (!Files.exists(copy)) {
				FileUtils.ensureDirectory(receiving.imagesDir());
				Files.copy(image, copy, StandardCopyOption.COPY_ATTRIBUTES);
				counters.imagesCopied++;
			}
			pin.downloadPath(copy.toString());
		} catch (IOException e) {
			error(counters, "Failed to copy image of pin " + pin.id() + ": " + e.getMessage());
			pin.downloaded(false).downloadPath(null);
		}
	}

	private static void error(Counters counters, String message) {
		logger.error(message);
		counters.errors.add(message);
	}
}
