package dev.pinharvest.model;

import java.util.Locale;

public enum TaskStatus {
	PENDING,
	DOWNLOADING,
	COMPLETED,
	FAILED;

	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static TaskStatus fromValue(String value) {
		return valueOf(value.toUpperCase(Locale.ROOT));
	}
}
