package dev.pinharvest.scraper;

import dev.pinharvest.model.Pin;
import dev.pinharvest.store.PersistenceException;
import dev.pinharvest.util.CancellationToken;
import dev.pinharvest.util.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;

/** Base class for all acquisition phases */
public abstract class BaseScraper implements Scraper {
	protected final PinCollector collector;
	protected final Logger logger;
	protected final int maxFailureCount;
	protected final CancellationToken cancellation;
	protected final Sleeper sleeper;

	private int failureCount = 0;
	private int savedCount = 0;
	private int skippedCount = 0;

	public BaseScraper(ScraperConfig config) {
		this.collector = config.collector();
		this.logger = config.logger();
		this.maxFailureCount = config.maxFailureCount();
		this.cancellation = config.cancellation();
		this.sleeper = config.sleeper();
	}

	/** Execute the scraping logic */
	protected abstract void scrape() throws Exception;

	/**
	 * Run the phase. Cancellation is not a result: it escapes as {@link CancellationException} so
	 * the whole run stops, also when it shows up as an interrupt during a pause.
	 */
	@Override
	public ScraperResult call() {
		try {
			log("Starting " + name() + " for '" + collector.keyword() + "'");

			try {
				checkCancelled();
				scrape();
			} catch (InterruptedProgressException e) {
				log(e.getMessage());
			}

			log("Completed " + name() + ". Saved " + savedCount + " pins, skipped " + skippedCount
					+ " duplicates, and had " + failureCount + " failures.");

			return ScraperResult.success(savedCount, skippedCount, failureCount);
		} catch (CancellationException e) {
			warn(name() + " cancelled after saving " + savedCount + " pins");
			throw e;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			warn(name() + " interrupted after saving " + savedCount + " pins");
			CancellationException cancelled = new CancellationException("Interrupted during " + name());
			cancelled.initCause(e);
			throw cancelled;
		} catch (TooManyFailuresException e) {
			warn("Aborted " + name() + " due to too many failures. Saved " + savedCount + " pins, skipped "
					+ skippedCount + " duplicates.");
			return ScraperResult.failure(savedCount, skippedCount, failureCount, e);
		} catch (Exception e) {
			warn(name() + " failed with error: " + e.getMessage() + " (saved " + savedCount + " pins, skipped "
					+ skippedCount + " duplicates)");
			return ScraperResult.failure(savedCount, skippedCount, failureCount, e);
		}
	}

	/** Log a informative message */
	protected void log(String message) {
		logger.info(message);
	}

	/** Log a detail message */
	protected void fine(String message) {
		logger.debug(message);
	}

	/** Log a warning message */
	protected void warn(String message) {
		logger.warn(message);
	}

	/** Log failure to process a single pin */
	protected void fail(String message, Exception error) {
		logger.error(message + ": " + error.getMessage());
		failureCount++;
		if (maxFailureCount > 0 && failureCount >= maxFailureCount) {
			throw new TooManyFailuresException("Too many failures, aborting");
		}
	}

	/**
	 * Persist the new pins of one extraction.
	 *
	 * @return the pins that were new
	 */
	protected List<Pin> process(List<Pin> pins) {
		List<Pin> added = new ArrayList<>();
		for (Pin pin : pins) {
			if (process(pin)) {
				added.add(pin);
			}
		}
		return added;
	}

	/** @return true if the pin was new and persisted */
	protected boolean process(Pin pin) {
		checkCancelled();
		boolean added = false;
		try {
			switch (collector.accept(pin)) {
				case SAVED -> {
					savedCount++;
					added = true;
				}
				case DUPLICATE -> skippedCount++;
				case REJECTED -> fine("Ignoring record without id");
			}
		} catch (PersistenceException e) {
			fail("Failed to save pin " + pin.id(), e);
		}
		if (collector.targetReached()) {
			throw new InterruptedProgressException(
					"Reached target of " + collector.target() + " pins for '" + collector.keyword() + "'");
		}
		return added;
	}

	protected void checkCancelled() {
		cancellation.throwIfCancelled();
	}

	/** Pause between page actions, cut short by cancellation */
	protected void pause(Duration duration) throws InterruptedException {
		checkCancelled();
		sleeper.sleep(duration);
		checkCancelled();
	}

	public int getSavedCount() {
		return savedCount;
	}
}
