package dev.pinharvest;

import dev.pinharvest.download.DefaultDownloadManager;
import dev.pinharvest.lock.LockContentionException;
import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.SqlitePinRepository;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Download command retrying the pending and failed images of existing keyword stores */
@Command(
		name = "download",
		description = "Download missing images of already collected pins without collecting new ones",
		mixinStandardHelpOptions = true)
public class DownloadCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-q", "--query"},
			description = "Keywords to process (if not specified, every keyword under the output directory)")
	List<String> queries;

	@Option(
			names = {"-o", "--output"},
			description = "Output directory (default: output)",
			defaultValue = "output")
	Path outputDir;

	@Option(
			names = {"-t", "--threads"},
			description = "Number of parallel download workers (default: 15)",
			defaultValue = "" + DefaultDownloadManager.DEFAULT_WORKERS)
	int threads;

	@Option(
			names = {"--proxy"},
			description = "Proxy server, e.g. http://host:port")
	String proxy;

	@Override
	public Integer call() throws IOException {
		logger.info("Pin Harvester - Download");
		logger.info("========================");
		logger.info("Output directory: {}", outputDir.toAbsolutePath());
		logger.info("");

		List<String> keywords = queries != null && !queries.isEmpty() ? queries : discoverKeywords(outputDir);
		if (keywords.isEmpty()) {
			logger.info("No keyword stores found in {}", outputDir.toAbsolutePath());
			return 0;
		}

		HarvesterConfig config =
				HarvesterConfig.defaults(outputDir).withDownloadWorkers(threads).withProxy(proxy);
		PinHarvester harvester = createHarvester(config);

		int exitCode = 0;
		int completed = 0;
		int failed = 0;
		for (String keyword : keywords) {
			try {
				DownloadSummary summary = harvester.download(keyword);
				logger.info("{}", summary);
				completed += summary.completed();
				failed += summary.failed();
			} catch (LockContentionException e) {
				logger.error("Error: {}", e.getMessage());
				exitCode = Main.EXIT_LOCKED;
			} catch (RuntimeException e) {
				logger.error("Downloads of '{}' failed: {}", keyword, e.getMessage());
				exitCode = Math.max(exitCode, 1);
			}
		}

		logger.info("");
		logger.info("Downloaded {} images, {} failed, over {} keywords", completed, failed, keywords.size());
		return exitCode;
	}

	PinHarvester createHarvester(HarvesterConfig config) {
		return PinHarvester.create(config);
	}

	/** Keywords stored under an output directory, read from each partition's database */
	static List<String> discoverKeywords(Path outputDir) throws IOException {
		List<String> keywords = new ArrayList<>();
		for (Path dir : KeywordPartition.findPartitionDirectories(outputDir)) {
			try (SqlitePinRepository repository =
					new SqlitePinRepository(dir.resolve(KeywordPartition.DATABASE_FILE))) {
				keywords.addAll(repository.getKeywords());
			}
		}
		return keywords;
	}
}
