package dev.pinharvest.scraper;

/** How a run acquires pins, chosen from the number of pins it still needs */
public enum HarvestStrategy {
	/** One scroll pass over the search page */
	SCROLL,
	/** One scroll pass with a larger scroll budget */
	DEEP_SCROLL,
	/** A scroll pass followed by related-pin expansion */
	HYBRID;

	static final int DEEP_SCROLL_THRESHOLD = 100;
	static final int HYBRID_THRESHOLD = 1000;
	static final int NO_NEW_LIMIT = 10;

	public static HarvestStrategy forTarget(int target) {
		if (target < DEEP_SCROLL_THRESHOLD) {
			return SCROLL;
		}
		if (target < HYBRID_THRESHOLD) {
			return DEEP_SCROLL;
		}
		return HYBRID;
	}

	/** Scroll limits of the first phase for a run that needs {@code target} pins */
	public ScrollStateMachine.Limits scrollLimits(int target) {
		int budget = this == DEEP_SCROLL ? Math.max(target * 3, 50) : Math.max(target * 3, 10);
		return new ScrollStateMachine.Limits(budget, NO_NEW_LIMIT);
	}

	public boolean expandsRelated() {
		return this == HYBRID;
	}
}
