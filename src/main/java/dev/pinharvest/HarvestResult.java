package dev.pinharvest;

import dev.pinharvest.model.Pin;
import dev.pinharvest.model.SessionStatus;
import java.util.List;

/**
 * Outcome of one {@link PinHarvester#scrape} call.
 *
 * @param pins up to the requested number of stored pins, in insertion order
 * @param saved pins persisted by this call
 * @param skipped duplicates seen by this call
 * @param failed pins that could not be persisted
 * @param fromCache true if the stored pins already met the target and nothing was acquired
 */
public record HarvestResult(
		String keyword,
		String sessionId,
		SessionStatus status,
		List<Pin> pins,
		int saved,
		int skipped,
		int failed,
		int downloadsCompleted,
		int downloadsFailed,
		boolean fromCache) {

	@Override
	public String toString() {
		return "%s: %s, %d pins (%d new, %d duplicates, %d failed), %d images downloaded, %d failed%s"
				.formatted(
						keyword,
						status.value(),
						pins.size(),
						saved,
						skipped,
						failed,
						downloadsCompleted,
						downloadsFailed,
						fromCache ? " (from cache)" : "");
	}
}
