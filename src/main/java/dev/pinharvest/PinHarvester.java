package dev.pinharvest;

import dev.pinharvest.browser.BrowserFactory;
import dev.pinharvest.browser.BrowserSessionHeaders;
import dev.pinharvest.browser.PlaywrightBrowser;
import dev.pinharvest.download.CandidateDownloader;
import dev.pinharvest.download.DefaultDownloadManager;
import dev.pinharvest.download.DownloadManager;
import dev.pinharvest.download.DownloadScheduler;
import dev.pinharvest.download.HttpFetcher;
import dev.pinharvest.download.NoOpDownloadManager;
import dev.pinharvest.download.RotatingHeaders;
import dev.pinharvest.extract.HtmlPinExtractor;
import dev.pinharvest.extract.PinExtractor;
import dev.pinharvest.lock.FileProcessLock;
import dev.pinharvest.lock.LockContentionException;
import dev.pinharvest.lock.ProcessLock;
import dev.pinharvest.model.Pin;
import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.model.TaskStatus;
import dev.pinharvest.reporting.ProgressReporter;
import dev.pinharvest.scraper.AcquisitionCoordinator;
import dev.pinharvest.scraper.AcquisitionResult;
import dev.pinharvest.scraper.ScraperResult;
import dev.pinharvest.session.SessionManager;
import dev.pinharvest.session.SessionPlan;
import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.PinRepository;
import dev.pinharvest.store.SqlitePinRepository;
import dev.pinharvest.util.CancellationToken;
import dev.pinharvest.util.HttpTransport;
import dev.pinharvest.util.HttpUtils;
import dev.pinharvest.util.JsonUtils;
import dev.pinharvest.util.Sleeper;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a harvest. Each {@link #scrape} call owns its keyword partition for the duration
 * of the call: it takes the keyword's process lock first, opens the store, runs the session,
 * acquisition and download stages in order and releases everything on every exit path.
 */
public class PinHarvester {
	public static final String PINS_EXPORT = "pins.json";
	public static final String STATS_EXPORT = "stats.json";

	private static final Logger logger = LoggerFactory.getLogger(PinHarvester.class);

	private final HarvesterConfig config;
	private final BrowserFactory browserFactory;
	private final PinExtractor extractor;
	private final HttpTransport transport;
	private final ProcessLock lock;
	private final Sleeper sleeper;
	private final Function<KeywordPartition, PinRepository> repositories;
	private final CancellationToken cancellation = new CancellationToken();
	private volatile DownloadManager activeDownloads;

	public PinHarvester(
			HarvesterConfig config,
			BrowserFactory browserFactory,
			PinExtractor extractor,
			HttpTransport transport,
			ProcessLock lock,
			Sleeper sleeper) {
		this(config, browserFactory, extractor, transport, lock, sleeper, SqlitePinRepository::open);
	}

	PinHarvester(
			HarvesterConfig config,
			BrowserFactory browserFactory,
			PinExtractor extractor,
			HttpTransport transport,
			ProcessLock lock,
			Sleeper sleeper,
			Function<KeywordPartition, PinRepository> repositories) {
		this.config = config;
		this.browserFactory = browserFactory;
		this.extractor = extractor;
		this.transport = transport;
		this.lock = lock;
		this.sleeper = sleeper;
		this.repositories = repositories;
	}

	/** Harvester wired to Playwright, Jsoup, the JDK HTTP client and file locks */
	public static PinHarvester create(HarvesterConfig config) {
		return new PinHarvester(
				config,
				PlaywrightBrowser.factory(config.headless(), config.proxy()),
				new HtmlPinExtractor(),
				new HttpUtils(config.proxy()),
				new FileProcessLock(config.outputDir()),
				Sleeper.SYSTEM);
	}

	/**
	 * Make sure at least {@code targetCount} pins are stored for a keyword and download their
	 * images.
	 *
	 * @param keywordOrUrl search keyword, or a Pinterest URL to scroll
	 * @return the first {@code targetCount} stored pins plus the counters of this call
	 * @throws LockContentionException if another process is harvesting the same keyword
	 * @throws dev.pinharvest.browser.BrowserLaunchException if no browser could be started
	 * @throws dev.pinharvest.store.PersistenceException if the store can't be opened or written
	 */
	public HarvestResult scrape(String keywordOrUrl, int targetCount) {
		if (targetCount < 1) {
			throw new IllegalArgumentException("Target count must be positive, got " + targetCount);
		}
		KeywordPartition partition = KeywordPartition.of(config.outputDir(), keywordOrUrl);
		acquireLock(partition);
		try (PinRepository repository = repositories.apply(partition);
				ProgressReporter reporter = new ProgressReporter()) {
			reporter.start();
			return run(partition, repository, reporter, targetCount);
		} finally {
			lock.release(partition.lockName());
		}
	}

	/**
	 * Download the missing images of an existing keyword partition without acquiring new pins.
	 *
	 * @throws LockContentionException if another process is harvesting the same keyword
	 */
	public DownloadSummary download(String keywordOrUrl) {
		KeywordPartition partition = KeywordPartition.of(config.outputDir(), keywordOrUrl);
		if (!Files.exists(partition.databaseFile())) {
			throw new IllegalArgumentException("No database for '" + keywordOrUrl + "' at " + partition.databaseFile());
		}
		acquireLock(partition);
		try (PinRepository repository = repositories.apply(partition);
				ProgressReporter reporter = new ProgressReporter()) {
			reporter.start();
			DownloadSummary summary = downloadImages(partition, repository, reporter);
			export(partition, repository, null, summary);
			return summary;
		} finally {
			lock.release(partition.lockName());
		}
	}

	/** Stop the running harvest: no new requests, queued downloads dropped, session interrupted */
	public void cancel() {
		if (cancellation.cancel()) {
			logger.warn("Cancellation requested");
		}
		DownloadManager downloads = activeDownloads;
		if (downloads != null) {
			downloads.cancel();
		}
	}

	public boolean isCancelled() {
		return cancellation.isCancelled();
	}

	private void acquireLock(KeywordPartition partition) {
		if (!lock.acquire(partition.lockName())) {
			throw new LockContentionException(partition.lockName());
		}
	}

	private HarvestResult run(
			KeywordPartition partition, PinRepository repository, ProgressReporter reporter, int targetCount) {
		String keyword = partition.keyword();
		SessionManager sessions =
				new SessionManager(repository, config.outputDir().toString(), config.downloadImages());
		SessionPlan plan = sessions.startOrResume(keyword, targetCount);

		if (plan.satisfied()) {
			List<Pin> pins = repository.loadPinsByQuery(keyword, targetCount, 0);
			return new HarvestResult(
					keyword, plan.sessionId(), SessionStatus.COMPLETED, pins, 0, 0, 0, 0, 0, true);
		}

		AcquisitionResult acquisition = null;
		DownloadSummary downloads = DownloadSummary.none(keyword);
		SessionStatus status;
		try {
			acquisition = coordinator(reporter).acquire(keyword, keyword, plan.sessionId(), plan.remaining(), repository);
			downloads = downloadImages(partition, repository, reporter);
			if (acquisition.saved() == 0 && acquisition.phases().stream().noneMatch(ScraperResult::success)) {
				sessions.fail(plan.sessionId(), keyword);
				status = SessionStatus.FAILED;
			} else {
				sessions.complete(plan.sessionId(), keyword);
				status = SessionStatus.COMPLETED;
			}
		} catch (CancellationException e) {
			int saved = sessions.interrupt(plan.sessionId(), keyword);
			logger.warn("Harvest of '{}' interrupted with {} pins stored", keyword, saved);
			status = SessionStatus.INTERRUPTED;
		} catch (RuntimeException e) {
			sessions.fail(plan.sessionId(), keyword);
			logger.error("Harvest of '{}' failed: {}", keyword, e.getMessage());
			throw e;
		}

		export(partition, repository, plan.sessionId(), downloads);
		int saved = repository.countPins(keyword) - plan.cachedCount();
		return new HarvestResult(
				keyword,
				plan.sessionId(),
				status,
				repository.loadPinsByQuery(keyword, targetCount, 0),
				saved,
				acquisition != null ? acquisition.skipped() : 0,
				acquisition != null ? acquisition.failed() : 0,
				downloads.completed(),
				downloads.failed(),
				false);
	}

	private AcquisitionCoordinator coordinator(ProgressReporter reporter) {
		return new AcquisitionCoordinator(
				browserFactory,
				extractor,
				transport,
				sleeper,
				cancellation,
				reporter,
				config.apiMode(),
				config.maxFailures(),
				config.maxPerSeed());
	}

	private DownloadSummary downloadImages(
			KeywordPartition partition, PinRepository repository, ProgressReporter reporter) {
		DownloadManager manager = config.downloadImages()
				? new DefaultDownloadManager(
						config.downloadWorkers(), repository, downloader(), reporter, "download:" + partition.lockName())
				: new NoOpDownloadManager();
		activeDownloads = manager;
		manager.start();
		try {
			DownloadScheduler.Report report = new DownloadScheduler(repository, partition, manager).schedule(cancellation);
			manager.shutdown();
			manager.awaitCompletion();
			cancellation.throwIfCancelled();
			int deferred = manager instanceof NoOpDownloadManager ? ((NoOpDownloadManager) manager).getDeferredCount() : 0;
			return new DownloadSummary(
					partition.keyword(), report, manager.getCompletedCount(), manager.getFailedCount(), deferred);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			manager.cancel();
			CancellationException cancelled = new CancellationException("Interrupted while downloading");
			cancelled.initCause(e);
			throw cancelled;
		} catch (CancellationException e) {
			manager.cancel();
			throw e;
		} catch (RuntimeException e) {
			manager.cancel();
			if (cancellation.isCancelled()) {
				// A cancel racing with the scheduler can surface as a shut down manager
				CancellationException cancelled = new CancellationException("Downloads cancelled");
				cancelled.initCause(e);
				throw cancelled;
			}
			throw e;
		} finally {
			activeDownloads = null;
		}
	}

	private CandidateDownloader downloader() {
		return new CandidateDownloader(
				List.of(
						new HttpFetcher("pooled", transport, new RotatingHeaders(), config.downloadTimeout()),
						new HttpFetcher(
								"browser-session",
								transport,
								new BrowserSessionHeaders(browserFactory),
								config.downloadTimeout())),
				config.retryPolicy(),
				sleeper);
	}

	// Exports are a convenience copy of the store; failing to write them doesn't fail the run
	private void export(
			KeywordPartition partition, PinRepository repository, String sessionId, DownloadSummary downloads) {
		String keyword = partition.keyword();
		Map<String, Object> stats = new LinkedHashMap<>();
		stats.put("keyword", keyword);
		if (sessionId != null) {
			ScrapingSession session = repository.getSession(sessionId).orElse(null);
			if (session != null) {
				stats.put("session_id", session.id());
				stats.put("status", session.status().value());
				stats.put("target_count", session.targetCount());
				stats.put("saved_count", session.savedCount());
			}
		}
		stats.put("total_pins", repository.countPins(keyword));
		Map<String, Integer> tasks = new LinkedHashMap<>();
		for (TaskStatus status : TaskStatus.values()) {
			tasks.put(status.value(), repository.countDownloadTasks(status));
		}
		stats.put("download_tasks", tasks);
		stats.put("downloads_completed", downloads.completed());
		stats.put("downloads_failed", downloads.failed());
		stats.put("generated_at", Instant.now().toString());
		try {
			JsonUtils.writeFile(partition.root().resolve(PINS_EXPORT), repository.loadPinsByQuery(keyword, null, 0));
			JsonUtils.writeFile(partition.root().resolve(STATS_EXPORT), stats);
		} catch (IOException e) {
			logger.warn("Failed to export results of '{}': {}", keyword, e.getMessage());
		}
	}
}
