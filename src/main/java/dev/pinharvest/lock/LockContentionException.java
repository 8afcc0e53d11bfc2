package dev.pinharvest.lock;

/** Another run already holds the lock of the keyword */
public class LockContentionException extends RuntimeException {
	private final String lockName;

	public LockContentionException(String lockName) {
		super("Another process is already scraping '" + lockName + "'");
		this.lockName = lockName;
	}

	public String lockName() {
		return lockName;
	}
}
