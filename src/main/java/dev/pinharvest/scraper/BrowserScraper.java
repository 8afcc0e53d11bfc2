package dev.pinharvest.scraper;

import dev.pinharvest.browser.BrowserAutomation;
import dev.pinharvest.extract.HtmlPinExtractor;
import dev.pinharvest.extract.PinExtractor;
import dev.pinharvest.model.Pin;
import java.time.Duration;
import java.util.List;

/** Base class for phases that read pins from pages rendered in the browser */
public abstract class BrowserScraper extends BaseScraper {
	static final int SCROLL_PIXELS = 3000;
	static final Duration SCROLL_PAUSE = Duration.ofMillis(1500);
	static final Duration SELECTOR_TIMEOUT = Duration.ofSeconds(10);

	protected final BrowserAutomation browser;
	protected final PinExtractor extractor;

	protected BrowserScraper(ScraperConfig config, BrowserAutomation browser, PinExtractor extractor) {
		super(config);
		this.browser = browser;
		this.extractor = extractor;
	}

	/**
	 * Load a page and collect the pins it shows before any scrolling.
	 *
	 * @return the new pins of the first screen
	 * @throws AcquisitionException if the page doesn't load
	 */
	protected List<Pin> openPage(String url) throws AcquisitionException {
		checkCancelled();
		if (!browser.navigate(url)) {
			throw new AcquisitionException("Could not load " + url);
		}
		if (!browser.waitForSelector(String.join(", ", HtmlPinExtractor.PIN_SELECTORS), SELECTOR_TIMEOUT)) {
			fine("No pin cards rendered yet on " + url);
		}
		return process(extractor.extractRecords(browser.getPageSource()));
	}

	/**
	 * Scroll the current page until the state machine reaches {@code DONE} or
	 * {@link #keepScrolling()} says otherwise.
	 *
	 * @return new pins collected while scrolling
	 */
	protected int scrollPage(ScrollStateMachine.Limits limits) throws InterruptedException {
		ScrollStateMachine machine = new ScrollStateMachine(limits);
		int collected = 0;
		while (!machine.isDone() && keepScrolling()) {
			checkCancelled();
			if (machine.state() == ScrollStateMachine.State.RECOVERING) {
				fine("Stalled at scroll " + machine.snapshot().scrolls() + ", scrolling back to trigger loading");
				browser.scroll(-SCROLL_PIXELS * 2);
				pause(SCROLL_PAUSE);
				browser.scroll(SCROLL_PIXELS * 3);
				pause(SCROLL_PAUSE.multipliedBy(2));
			} else {
				browser.scroll(SCROLL_PIXELS);
				pause(SCROLL_PAUSE);
			}
			List<Pin> added = process(extractor.extractRecords(browser.getPageSource()));
			onNewPins(added);
			collected += added.size();
			machine.onScroll(added.size(), collector.targetReached());
		}
		ScrollStateMachine.Snapshot last = machine.snapshot();
		fine("Stopped scrolling after " + last.scrolls() + " scrolls (" + last.consecutiveNoNew()
				+ " without new pins)");
		return collected;
	}

	/** Called with the new pins of every scroll */
	protected void onNewPins(List<Pin> added) {}

	/** Extra stop condition checked before every scroll */
	protected boolean keepScrolling() {
		return true;
	}
}
