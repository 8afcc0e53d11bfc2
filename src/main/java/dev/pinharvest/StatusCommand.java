package dev.pinharvest;

import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.TaskStatus;
import dev.pinharvest.store.CacheMetadata;
import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.SqlitePinRepository;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Status command listing the stored keywords with their sessions and download progress */
@Command(
		name = "status",
		description = "Show pins, sessions and download tasks of every keyword store",
		mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-o", "--output"},
			description = "Output directory (default: output)",
			defaultValue = "output")
	Path outputDir;

	@Option(
			names = {"--sessions"},
			description = "Maximum number of sessions shown per keyword (default: 5)",
			defaultValue = "5")
	int maxSessions;

	@Override
	public Integer call() throws IOException {
		List<Path> partitions = KeywordPartition.findPartitionDirectories(outputDir);
		if (partitions.isEmpty()) {
			logger.info("No keyword stores found in {}", outputDir.toAbsolutePath());
			return 0;
		}
		for (Path dir : partitions) {
			try (SqlitePinRepository repository =
					new SqlitePinRepository(dir.resolve(KeywordPartition.DATABASE_FILE))) {
				for (String keyword : repository.getKeywords()) {
					printKeyword(repository, keyword, dir);
				}
			}
		}
		return 0;
	}

	private void printKeyword(SqlitePinRepository repository, String keyword, Path dir) {
		logger.info("{} ({})", keyword, dir);
		String updated = repository.getCacheMetadata(keyword)
				.map(CacheMetadata::lastUpdated)
				.map(Object::toString)
				.orElse("never");
		logger.info("  Pins: {} (last updated {})", repository.countPins(keyword), updated);
		String tasks = Arrays.stream(TaskStatus.values())
				.map(status -> status.value() + "=" + repository.countDownloadTasks(status))
				.collect(Collectors.joining(", "));
		logger.info("  Download tasks: {}", tasks);
		List<ScrapingSession> sessions = repository.getSessions(keyword);
		for (ScrapingSession session : sessions.subList(0, Math.min(maxSessions, sessions.size()))) {
			logger.info(
					"  Session {}: {} target={} saved={} started={}",
					session.id(),
					session.status().value(),
					session.targetCount(),
					session.savedCount(),
					session.startedAt());
		}
	}
}
