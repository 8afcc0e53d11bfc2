package dev.pinharvest.reporting;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of progress events. The acquisition thread and all download workers only put
 * events on the queue; the reporter thread is the only one that touches the running-stage set and
 * the per-stage progress counts, and the only one that logs progress lines.
 */
public class ProgressReporter implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.progress("SHUTDOWN", "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final Set<String> runningStages;
	private final Map<String, Integer> progressCounts;
	private final AtomicBoolean running;
	private Thread reporterThread;

	public ProgressReporter() {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.runningStages = new LinkedHashSet<>();
		this.progressCounts = new HashMap<>();
		this.running = new AtomicBoolean(false);
	}

	/** Start the reporter thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "ProgressReporter");
			reporterThread.setDaemon(true);
			reporterThread.start();
		}
	}

	/** Submit a progress event to be processed */
	public void report(ProgressEvent event) {
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();
				if (event == POISON_PILL) {
					break;
				}
				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (Exception e) {
				logger.error("Error processing event", e);
			}
		}
	}

	private void processEvent(ProgressEvent event) {
		String stage = event.stage();
		switch (event.eventType()) {
			case STARTED -> {
				runningStages.add(stage);
				progressCounts.put(stage, 0);
				logger.info("STARTED: {} | Running stages: {}", stage, runningStages.size());
			}
			case PROGRESS -> {
				int count = progressCounts.merge(stage, 1, Integer::sum);
				logger.info("PROGRESS: {} #{} - {}", stage, count, event.message());
			}
			case COMPLETED -> {
				runningStages.remove(stage);
				logger.info("COMPLETED: {} - {}", stage, event.message());
			}
			case FAILED -> {
				runningStages.remove(stage);
				if (event.error() != null) {
					logger.error("FAILED: {} - {}", stage, event.message(), event.error());
				} else {
					logger.error("FAILED: {} - {}", stage, event.message());
				}
			}
		}
	}

	/** Stop the reporter after all queued events were processed */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
