package dev.pinharvest.reporting;

import java.time.Instant;

/** Progress event of one stage (acquisition or downloads) of a keyword run */
public record ProgressEvent(String stage, EventType eventType, String message, Instant timestamp, Throwable error) {
	public enum EventType {
		STARTED,
		PROGRESS,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(String stage) {
		return new ProgressEvent(stage, EventType.STARTED, "Started", Instant.now(), null);
	}

	public static ProgressEvent progress(String stage, String message) {
		return new ProgressEvent(stage, EventType.PROGRESS, message, Instant.now(), null);
	}

	public static ProgressEvent completed(String stage, String message) {
		return new ProgressEvent(stage, EventType.COMPLETED, message, Instant.now(), null);
	}

	public static ProgressEvent failed(String stage, String message, Throwable error) {
		return new ProgressEvent(stage, EventType.FAILED, message, Instant.now(), error);
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, stage, eventType, message);
	}
}
