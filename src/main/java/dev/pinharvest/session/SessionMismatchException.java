package dev.pinharvest.session;

/** A stored incomplete session doesn't describe the run being requested */
public class SessionMismatchException extends Exception {
	public SessionMismatchException(String message) {
		super(message);
	}
}
