package dev.pinharvest.scraper;

import dev.pinharvest.model.Pin;
import java.util.List;

/**
 * Outcome of the acquisition part of one run.
 *
 * @param strategy strategy chosen for the remaining count
 * @param phases results of the phases that ran, in order
 * @param savedPins pins this run persisted
 */
public record AcquisitionResult(HarvestStrategy strategy, List<ScraperResult> phases, List<Pin> savedPins) {

	public int saved() {
		return savedPins.size();
	}

	public int skipped() {
		return phases.stream().mapToInt(ScraperResult::itemsSkipped).sum();
	}

	public int failed() {
		return phases.stream().mapToInt(ScraperResult::itemsFailed).sum();
	}
}
