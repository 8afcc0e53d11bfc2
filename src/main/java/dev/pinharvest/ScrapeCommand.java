package dev.pinharvest;

import dev.pinharvest.download.DefaultDownloadManager;
import dev.pinharvest.download.RetryPolicy;
import dev.pinharvest.lock.LockContentionException;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.scraper.RelatedPinsScraper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Scrape command harvesting pins for one or more keywords, or for one URL */
@Command(
		name = "scrape",
		description = "Collect pins for keywords or a Pinterest URL and download their images",
		mixinStandardHelpOptions = true)
public class ScrapeCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");
	private static final long SHUTDOWN_GRACE_SECONDS = 30;

	static class Source {
		@Option(
				names = {"-q", "--query"},
				description = "Search keyword; repeat to run several keywords one after the other",
				required = true)
		List<String> queries;

		@Option(
				names = {"-u", "--url"},
				description = "Pinterest board or search URL to scroll",
				required = true)
		String url;

		List<String> targets() {
			return url != null ? List.of(url) : queries;
		}
	}

	@ArgGroup(exclusive = true, multiplicity = "1")
	Source source;

	@Option(
			names = {"-c", "--count"},
			description = "Number of pins to collect per keyword (default: 50)",
			defaultValue = "50")
	int count;

	@Option(
			names = {"-o", "--output"},
			description = "Output directory (default: output)",
			defaultValue = "output")
	Path outputDir;

	@Option(
			names = {"--no-images"},
			description = "Only collect pin data; download tasks stay pending")
	boolean noImages;

	@Option(
			names = {"--proxy"},
			description = "Proxy server, e.g. http://host:port")
	String proxy;

	@Option(
			names = {"--debug"},
			description = "Verbose logging and a visible browser window")
	boolean debug;

	@Option(
			names = {"--api"},
			description = "Page through the search API instead of scrolling (falls back to scrolling)")
	boolean apiMode;

	@Option(
			names = {"-t", "--threads"},
			description = "Number of parallel download workers (default: 15)",
			defaultValue = "" + DefaultDownloadManager.DEFAULT_WORKERS)
	int threads;

	@Option(
			names = {"--max-failures"},
			description = "Maximum number of failed pins per phase before aborting that phase (default: 10)",
			defaultValue = "" + HarvesterConfig.DEFAULT_MAX_FAILURES)
	int maxFailures;

	@Override
	public Integer call() {
		if (debug) {
			Main.enableDebugLogging();
		}
		if (count < 1) {
			logger.error("Count must be positive, got {}", count);
			return 1;
		}

		HarvesterConfig config = new HarvesterConfig(
				outputDir,
				proxy,
				!noImages,
				!debug,
				apiMode,
				threads,
				maxFailures,
				RelatedPinsScraper.DEFAULT_MAX_PER_SEED,
				HarvesterConfig.DEFAULT_DOWNLOAD_TIMEOUT,
				RetryPolicy.defaults().maxAttempts(),
				RetryPolicy.defaults().maxForbiddenRetries());

		logger.info("Pin Harvester");
		logger.info("=============");
		logger.info("Output directory: {}", outputDir.toAbsolutePath());
		logger.info("Targets: {} ({} pins each)", String.join(", ", source.targets()), count);
		logger.info("Images: {}", noImages ? "disabled" : threads + " download workers");
		logger.info("");

		PinHarvester harvester = createHarvester(config);
		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = new Thread(
				() -> {
					harvester.cancel();
					try {
						finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				},
				"harvest-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		long startTime = System.currentTimeMillis();
		List<HarvestResult> results = new ArrayList<>();
		int exitCode = 0;
		try {
			for (String target : source.targets()) {
				if (harvester.isCancelled()) {
					logger.warn("Skipping '{}' after cancellation", target);
					continue;
				}
				try {
					HarvestResult result = harvester.scrape(target, count);
					results.add(result);
					if (result.status() == SessionStatus.FAILED) {
						exitCode = Math.max(exitCode, 1);
					}
				} catch (LockContentionException e) {
					logger.error("Error: {}", e.getMessage());
					exitCode = Main.EXIT_LOCKED;
				} catch (RuntimeException e) {
					logger.error("Harvest of '{}' failed: {}", target, e.getMessage(), e);
					exitCode = Math.max(exitCode, 1);
				}
			}
		} finally {
			finished.countDown();
			removeShutdownHook(shutdownHook);
		}

		logger.info("");
		logger.info("Execution Summary");
		logger.info("=================");
		for (HarvestResult result : results) {
			logger.info("{}", result);
		}
		double duration = (System.currentTimeMillis() - startTime) / 1000.0;
		logger.info("Completed {} of {} targets in {} seconds", results.size(), source.targets().size(), duration);
		if (harvester.isCancelled()) {
			return Math.max(exitCode, 1);
		}
		return exitCode;
	}

	PinHarvester createHarvester(HarvesterConfig config) {
		return PinHarvester.create(config);
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			logger.debug("JVM is shutting down, shutdown hook stays registered");
		}
	}
}
