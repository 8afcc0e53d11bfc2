package dev.pinharvest.scraper;

/** Thrown when a scraper has seen more failed pins than it is allowed to */
public class TooManyFailuresException extends RuntimeException {
	public TooManyFailuresException(String message) {
		super(message);
	}
}
