package dev.pinharvest;

import dev.pinharvest.lock.FileProcessLock;
import dev.pinharvest.store.PartitionMerger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Merge command folding the keyword stores of one output tree into another */
@Command(
		name = "merge",
		description = "Merge the keyword databases of a target directory into a source directory (source wins)",
		mixinStandardHelpOptions = true)
public class MergeCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-s", "--source"},
			description = "Output directory receiving the pins (default: output)",
			defaultValue = "output")
	Path sourceDir;

	@Option(
			names = {"-t", "--target"},
			description = "Output directory whose pins are merged in",
			required = true)
	Path targetDir;

	@Option(
			names = {"--dry-run"},
			description = "Only show what would be merged")
	boolean dryRun;

	@Override
	public Integer call() {
		logger.info("Pin Harvester - Merge");
		logger.info("=====================");
		logger.info("Source directory: {}", sourceDir.toAbsolutePath());
		logger.info("Target directory: {}", targetDir.toAbsolutePath());
		if (dryRun) {
			logger.info("Dry run: nothing will be written");
		}
		logger.info("");

		if (!Files.isDirectory(targetDir)) {
			logger.error("Error: Target directory not found: {}", targetDir.toAbsolutePath());
			return 1;
		}
		if (sourceDir.toAbsolutePath().normalize().equals(targetDir.toAbsolutePath().normalize())) {
			logger.error("Error: Source and target are the same directory");
			return 1;
		}

		PartitionMerger.MergeStats stats;
		try {
			stats = new PartitionMerger(sourceDir, targetDir, dryRun, new FileProcessLock(sourceDir)).mergeAll();
		} catch (IOException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}

		logger.info("");
		logger.info("Merge Summary");
		logger.info("=============");
		logger.info("Keywords: {}", stats.keywords());
		logger.info("Pins processed: {}", stats.pinsProcessed());
		logger.info("Pins {}: {}", dryRun ? "to merge" : "merged", stats.pinsMerged());
		logger.info("Pins skipped: {}", stats.pinsSkipped());
		logger.info("Images copied: {}", stats.imagesCopied());
		logger.info("Errors: {}", stats.errors());
		for (String error : stats.errorDetails()) {
			logger.info("  - {}", error);
		}
		return stats.errors() == 0 ? 0 : 1;
	}
}
