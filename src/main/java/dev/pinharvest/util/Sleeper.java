package dev.pinharvest.util;

import java.time.Duration;

/** Abstraction over {@link Thread#sleep} so pacing and backoff can be skipped in tests */
@FunctionalInterface
public interface Sleeper {
	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;
}
