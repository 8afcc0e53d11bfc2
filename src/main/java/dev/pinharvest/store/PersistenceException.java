package dev.pinharvest.store;

/** A single write or read against a keyword database failed */
public class PersistenceException extends RuntimeException {
	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
