package dev.pinharvest.scraper;

/**
 * Decides when an infinite-scroll page is exhausted. Transitions are a pure function of the
 * current snapshot and the outcome of one scroll; the instance only keeps the latest snapshot.
 *
 * <pre>
 * SCROLLING --no new pins--> STALLED --half the no-new limit--> RECOVERING
 *     ^                         |                                   |
 *     +-------new pins----------+-----------------------------------+
 * any state --target, no-new limit or scroll budget--> DONE
 * </pre>
 *
 * Recovery is attempted once per stall; new pins re-arm it.
 */
public class ScrollStateMachine {
	public enum State {
		SCROLLING,
		STALLED,
		RECOVERING,
		DONE
	}

	/**
	 * @param maxScrolls scroll budget of the page
	 * @param noNewLimit consecutive scrolls without new pins after which the page is given up
	 */
	public record Limits(int maxScrolls, int noNewLimit) {
		public Limits {
			if (maxScrolls < 1 || noNewLimit < 1) {
				throw new IllegalArgumentException("Scroll limits must be positive");
			}
		}

		int recoveryThreshold() {
			return Math.max(1, noNewLimit / 2);
		}
	}

	public record Snapshot(State state, int scrolls, int consecutiveNoNew, boolean recoveryUsed) {
		public static final Snapshot INITIAL = new Snapshot(State.SCROLLING, 0, 0, false);
	}

	private final Limits limits;
	private Snapshot snapshot = Snapshot.INITIAL;

	public ScrollStateMachine(Limits limits) {
		this.limits = limits;
	}

	/**
	 * Transition after one scroll.
	 *
	 * @param newItems pins the scroll added
	 * @param targetReached whether the run has collected all it wants
	 */
	public static Snapshot next(Snapshot current, int newItems, boolean targetReached, Limits limits) {
		if (current.state() == State.DONE) {
			return current;
		}
		int scrolls = current.scrolls() + 1;
		int noNew = newItems > 0 ? 0 : current.consecutiveNoNew() + 1;
		if (targetReached || noNew >= limits.noNewLimit() || scrolls >= limits.maxScrolls()) {
			return new Snapshot(State.DONE, scrolls, noNew, current.recoveryUsed());
		}
		if (newItems > 0) {
			return new Snapshot(State.SCROLLING, scrolls, 0, false);
		}
		if (!current.recoveryUsed() && noNew >= limits.recoveryThreshold()) {
			return new Snapshot(State.RECOVERING, scrolls, noNew, true);
		}
		return new Snapshot(State.STALLED, scrolls, noNew, current.recoveryUsed());
	}

	public State onScroll(int newItems, boolean targetReached) {
		snapshot = next(snapshot, newItems, targetReached, limits);
		return snapshot.state();
	}

	public State state() {
		return snapshot.state();
	}

	public boolean isDone() {
		return snapshot.state() == State.DONE;
	}

	public Snapshot snapshot() {
		return snapshot;
	}
}
