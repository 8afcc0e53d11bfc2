package dev.pinharvest.scraper;

/** Result of a scraper execution */
public record ScraperResult(boolean success, int itemsSaved, int itemsSkipped, int itemsFailed, Exception error) {

	public static ScraperResult success(int itemsSaved, int itemsSkipped, int itemsFailed) {
		return new ScraperResult(true, itemsSaved, itemsSkipped, itemsFailed, null);
	}

	/** A failed phase still reports what it persisted before the error */
	public static ScraperResult failure(int itemsSaved, int itemsSkipped, int itemsFailed, Exception error) {
		return new ScraperResult(false, itemsSaved, itemsSkipped, itemsFailed, error);
	}

	public static ScraperResult failure(Exception error) {
		return failure(0, 0, 0, error);
	}

	@Override
	public String toString() {
		return success
				? "SUCCESS (%d pins saved, %d duplicates skipped, %d failed)"
						.formatted(itemsSaved, itemsSkipped, itemsFailed)
				: "FAILED - %s (%d pins saved)"
						.formatted(error != null ? error.getMessage() : "Unknown error", itemsSaved);
	}
}
