package dev.pinharvest.scraper;

import dev.pinharvest.browser.BrowserAutomation;
import dev.pinharvest.extract.PinExtractor;
import dev.pinharvest.model.Pin;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a set of seed pins breadth-first through the "more like this" section of their detail
 * pages. Every new pin becomes a further seed.
 */
public class RelatedPinsScraper extends BrowserScraper {
	public static final int DEFAULT_MAX_PER_SEED = 50;
	static final int MAX_BARREN_SEEDS = 30;
	static final ScrollStateMachine.Limits SEED_LIMITS = new ScrollStateMachine.Limits(20, 3);

	private final Deque<String> queue;
	private final Set<String> visited = new HashSet<>();
	private final int maxPerSeed;
	private int fromCurrentSeed;

	public RelatedPinsScraper(
			ScraperConfig config,
			BrowserAutomation browser,
			PinExtractor extractor,
			Collection<String> seeds,
			int maxPerSeed) {
		super(config, browser, extractor);
		this.queue = new ArrayDeque<>(seeds);
		this.maxPerSeed = maxPerSeed;
	}

	@Override
	public String name() {
		return "related";
	}

	@Override
	protected void scrape() throws InterruptedException {
		int barrenSeeds = 0;
		int seedsVisited = 0;
		while (!queue.isEmpty()) {
			checkCancelled();
			String seed = queue.poll();
			if (!visited.add(seed)) {
				continue;
			}
			seedsVisited++;
			fromCurrentSeed = 0;
			try {
				onNewPins(openPage(PinterestUrls.pinUrl(seed)));
				if (keepScrolling()) {
					scrollPage(SEED_LIMITS);
				}
			} catch (AcquisitionException e) {
				fail("Failed to expand seed " + seed, e);
			}
			fine("Seed " + seed + " gave " + fromCurrentSeed + " new pins, " + queue.size() + " seeds queued");
			barrenSeeds = fromCurrentSeed == 0 ? barrenSeeds + 1 : 0;
			if (barrenSeeds >= MAX_BARREN_SEEDS) {
				log("Stopping related expansion after " + barrenSeeds + " seeds without new pins");
				return;
			}
		}
		log("Related expansion ran out of seeds after " + seedsVisited + " seeds");
	}

	@Override
	protected void onNewPins(List<Pin> added) {
		fromCurrentSeed += added.size();
		for (Pin pin : added) {
			queue.add(pin.id());
		}
	}

	@Override
	protected boolean keepScrolling() {
		return fromCurrentSeed < maxPerSeed;
	}
}
