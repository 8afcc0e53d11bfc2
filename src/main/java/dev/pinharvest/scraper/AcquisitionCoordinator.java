package dev.pinharvest.scraper;

import dev.pinharvest.browser.BrowserAutomation;
import dev.pinharvest.browser.BrowserFactory;
import dev.pinharvest.extract.PinExtractor;
import dev.pinharvest.model.Pin;
import dev.pinharvest.reporting.ProgressEvent;
import dev.pinharvest.reporting.ProgressReporter;
import dev.pinharvest.store.PinRepository;
import dev.pinharvest.util.CancellationToken;
import dev.pinharvest.util.FileUtils;
import dev.pinharvest.util.HttpTransport;
import dev.pinharvest.util.Sleeper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the acquisition phases of one keyword: a scroll or API pass over the search results and,
 * for large targets, related-pin expansion from the pins found so far. One browser session serves
 * all phases and is closed on every exit path.
 */
public class AcquisitionCoordinator {
	private final BrowserFactory browserFactory;
	private final PinExtractor extractor;
	private final HttpTransport transport;
	private final Sleeper sleeper;
	private final CancellationToken cancellation;
	private final ProgressReporter reporter;
	private final boolean apiMode;
	private final int maxFailures;
	private final int maxPerSeed;

	public AcquisitionCoordinator(
			BrowserFactory browserFactory,
			PinExtractor extractor,
			HttpTransport transport,
			Sleeper sleeper,
			CancellationToken cancellation,
			ProgressReporter reporter,
			boolean apiMode,
			int maxFailures,
			int maxPerSeed) {
		this.browserFactory = browserFactory;
		this.extractor = extractor;
		this.transport = transport;
		this.sleeper = sleeper;
		this.cancellation = cancellation;
		this.reporter = reporter;
		this.apiMode = apiMode;
		this.maxFailures = maxFailures;
		this.maxPerSeed = maxPerSeed;
	}

	/**
	 * Collect up to {@code remaining} new pins.
	 *
	 * @param keywordOrUrl search keyword, or a board/search URL to scroll
	 * @param keyword partition keyword the pins are stored under
	 * @throws java.util.concurrent.CancellationException if the run was cancelled
	 * @throws dev.pinharvest.browser.BrowserLaunchException if no browser could be started
	 */
	public AcquisitionResult acquire(
			String keywordOrUrl, String keyword, String sessionId, int remaining, PinRepository repository) {
		HarvestStrategy strategy = HarvestStrategy.forTarget(remaining);
		String stage = "acquire:" + keyword;
		Logger logger = LoggerFactory.getLogger("scraper." + FileUtils.sanitizeName(keyword));
		PinCollector collector = new PinCollector(repository, keyword, sessionId, remaining, reporter, stage);
		ScraperConfig config = new ScraperConfig(collector, logger, maxFailures, cancellation, sleeper);
		List<ScraperResult> phases = new ArrayList<>();

		logger.info("Acquiring {} pins for '{}' with strategy {}", remaining, keyword, strategy);
		report(ProgressEvent.started(stage));
		try (BrowserAutomation browser = browserFactory.open()) {
			boolean isUrl = PinterestUrls.isUrl(keywordOrUrl);
			String startUrl = isUrl ? keywordOrUrl : PinterestUrls.searchUrl(keywordOrUrl);
			Scraper scroll = new ScrollScraper(config, browser, extractor, startUrl, strategy.scrollLimits(remaining));

			if (apiMode && !isUrl) {
				ScraperResult api = new ApiScraper(config, browser, transport, keywordOrUrl).call();
				phases.add(api);
				if (!api.success() && api.error() instanceof AcquisitionException) {
					logger.warn("API acquisition unavailable ({}), falling back to scrolling", api.error().getMessage());
					phases.add(scroll.call());
				}
			} else {
				phases.add(scroll.call());
			}

			if (strategy.expandsRelated() && !collector.targetReached()) {
				Set<String> seeds = seeds(collector, repository, keyword);
				logger.info("Phase 1 saved {} pins, expanding {} seeds", collector.savedCount(), seeds.size());
				phases.add(new RelatedPinsScraper(config, browser, extractor, seeds, maxPerSeed).call());
			}
		} catch (RuntimeException e) {
			report(ProgressEvent.failed(stage, "stopped after " + collector.savedCount() + " pins", e));
			throw e;
		}

		report(ProgressEvent.completed(stage, collector.savedCount() + " new pins"));
		logger.info("Acquired {} of {} pins for '{}'", collector.savedCount(), remaining, keyword);
		return new AcquisitionResult(strategy, phases, collector.savedPins());
	}

	// Pins of this run first, then the ones stored by earlier runs
	private static Set<String> seeds(PinCollector collector, PinRepository repository, String keyword) {
		Set<String> seeds = new LinkedHashSet<>();
		for (Pin pin : collector.savedPins()) {
			seeds.add(pin.id());
		}
		seeds.addAll(repository.getPinIds(keyword));
		return seeds;
	}

	private void report(ProgressEvent event) {
		if (reporter != null) {
			reporter.report(event);
		}
	}
}
