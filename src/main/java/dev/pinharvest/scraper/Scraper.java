package dev.pinharvest.scraper;

import java.util.concurrent.Callable;

/**
 * One acquisition phase of a keyword run. Scrapers implement {@link Callable} so the coordinator
 * can run them uniformly and inspect their {@link ScraperResult}.
 */
public interface Scraper extends Callable<ScraperResult> {

	/** Short name used in logs and progress events */
	String name();

	@Override
	ScraperResult call();
}
