package dev.pinharvest.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag shared by the acquisition loops and the download scheduler */
public class CancellationToken {
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	/** @return true if this call cancelled the token, false if it was already cancelled */
	public boolean cancel() {
		return cancelled.compareAndSet(false, true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * @throws CancellationException if the token was cancelled
	 */
	public void throwIfCancelled() {
		if (cancelled.get()) {
			throw new CancellationException("Run was cancelled");
		}
	}
}
