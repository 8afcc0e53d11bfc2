package dev.pinharvest.scraper;

/** Thrown when a scraper reached its target; ends the scraper normally */
public class InterruptedProgressException extends RuntimeException {
	public InterruptedProgressException(String message) {
		super(message);
	}
}
