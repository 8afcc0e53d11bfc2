package dev.pinharvest.model;

import java.util.Locale;

/** Lifecycle states of a scraping session. Only RUNNING can be resumed directly. */
public enum SessionStatus {
	RUNNING,
	COMPLETED,
	INTERRUPTED,
	FAILED;

	/** The value stored in the database */
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}

	public static SessionStatus fromValue(String value) {
		return valueOf(value.toUpperCase(Locale.ROOT));
	}
}
