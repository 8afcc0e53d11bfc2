package dev.pinharvest.scraper;

import dev.pinharvest.model.Pin;
import dev.pinharvest.reporting.ProgressEvent;
import dev.pinharvest.reporting.ProgressReporter;
import dev.pinharvest.store.PinRepository;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicates extracted pins and persists each new one immediately. The seen-set starts with the
 * ids already stored for the keyword; the repository's own uniqueness is the final word, so a pin
 * the store reports as a duplicate is counted as one even if this collector hadn't seen it.
 */
public class PinCollector {
	public enum Outcome {
		SAVED,
		DUPLICATE,
		REJECTED
	}

	private final PinRepository repository;
	private final String keyword;
	private final String sessionId;
	private final int target;
	private final ProgressReporter reporter;
	private final String stage;
	private final Set<String> seen;
	private final List<Pin> saved = new ArrayList<>();

	/**
	 * @param target number of new pins this run wants
	 * @param reporter progress channel, or null
	 */
	public PinCollector(
			PinRepository repository,
			String keyword,
			String sessionId,
			int target,
			ProgressReporter reporter,
			String stage) {
		this.repository = repository;
		this.keyword = keyword;
		this.sessionId = sessionId;
		this.target = target;
		this.reporter = reporter;
		this.stage = stage;
		this.seen = new HashSet<>(repository.getPinIds(keyword));
	}

	/**
	 * Persist a pin unless it was seen before.
	 *
	 * @throws dev.pinharvest.store.PersistenceException if the store write fails
	 */
	public synchronized Outcome accept(Pin pin) {
		if (pin == null || pin.id() == null || pin.id().isBlank()) {
			return Outcome.REJECTED;
		}
		if (seen.contains(pin.id())) {
			return Outcome.DUPLICATE;
		}
		boolean inserted = repository.savePinImmediately(pin, keyword, sessionId);
		seen.add(pin.id());
		if (!inserted) {
			return Outcome.DUPLICATE;
		}
		saved.add(pin);
		if (reporter != null) {
			reporter.report(ProgressEvent.progress(stage, "pin " + pin.id() + " saved (" + saved.size() + "/" + target + ")"));
		}
		return Outcome.SAVED;
	}

	public synchronized boolean targetReached() {
		return saved.size() >= target;
	}

	public synchronized int savedCount() {
		return saved.size();
	}

	public synchronized int remaining() {
		return Math.max(0, target - saved.size());
	}

	/** Pins saved by this run, in the order they were saved */
	public synchronized List<Pin> savedPins() {
		return new ArrayList<>(saved);
	}

	public String keyword() {
		return keyword;
	}

	public int target() {
		return target;
	}
}
