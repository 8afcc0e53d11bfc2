package dev.pinharvest.lock;

/** Advisory lock that keeps two acquisition runs of the same keyword apart */
public interface ProcessLock {
	/**
	 * Try to take the lock without blocking.
	 *
	 * @return true if this process now holds the lock, false if another holder has it
	 */
	boolean acquire(String name);

	/** Release a lock held by this process. Releasing a lock that isn't held is a no-op. */
	void release(String name);
}
