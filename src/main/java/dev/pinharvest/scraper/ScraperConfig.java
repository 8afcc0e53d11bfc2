package dev.pinharvest.scraper;

import dev.pinharvest.util.CancellationToken;
import dev.pinharvest.util.Sleeper;
import org.slf4j.Logger;

/**
 * Configuration record for scraper instances. Every phase of one run shares the same collector,
 * so the seen-set and the target carry over from one phase to the next.
 */
public record ScraperConfig(
		PinCollector collector, Logger logger, int maxFailureCount, CancellationToken cancellation, Sleeper sleeper) {}
