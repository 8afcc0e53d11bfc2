package dev.pinharvest.scraper;

import dev.pinharvest.browser.BrowserAutomation;
import dev.pinharvest.extract.PinExtractor;

/** Collects pins by scrolling a search or board page until the scroll state machine gives up */
public class ScrollScraper extends BrowserScraper {
	private final String startUrl;
	private final ScrollStateMachine.Limits limits;

	public ScrollScraper(
			ScraperConfig config,
			BrowserAutomation browser,
			PinExtractor extractor,
			String startUrl,
			ScrollStateMachine.Limits limits) {
		super(config, browser, extractor);
		this.startUrl = startUrl;
		this.limits = limits;
	}

	@Override
	public String name() {
		return "scroll";
	}

	@Override
	protected void scrape() throws AcquisitionException, InterruptedException {
		int initial = openPage(startUrl).size();
		fine("First screen of " + startUrl + " gave " + initial + " new pins");
		scrollPage(limits);
	}
}
