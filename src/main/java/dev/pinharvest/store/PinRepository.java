package dev.pinharvest.store;

import dev.pinharvest.model.DownloadTask;
import dev.pinharvest.model.Pin;
import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.model.TaskStatus;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent store of one keyword partition. Holds pins, scraping sessions and download tasks and
 * is the single source of truth for deduplication and resumption. Implementations must be safe to
 * call from the acquisition thread and all download workers at the same time.
 */
public interface PinRepository extends AutoCloseable {

	/**
	 * Create a new session in the {@code running} state.
	 *
	 * @return the id of the new session
	 */
	String createSession(String keyword, int targetCount, String outputDir, boolean downloadImages);

	/**
	 * Get the running and interrupted sessions of a keyword.
	 *
	 * @return the sessions, newest first
	 */
	List<ScrapingSession> getIncompleteSessions(String keyword);

	/** All sessions of a keyword, newest first */
	List<ScrapingSession> getSessions(String keyword);

	Optional<ScrapingSession> getSession(String sessionId);

	/**
	 * Move an incomplete session back to {@code running}. Any other running session of the same
	 * keyword is marked interrupted first so at most one stays running.
	 *
	 * @return true if the session existed and was resumable
	 */
	boolean resumeSession(String sessionId);

	/** Set status and saved count; completed and failed sessions also get their completion time */
	void updateSessionStatus(String sessionId, SessionStatus status, int savedCount);

	/**
	 * Insert a pin, or refresh the stored copy if the id already exists. A new pin also updates the
	 * cache metadata and the session's saved count in the same transaction.
	 *
	 * @return true if a new row was written, false for a duplicate or an invalid pin
	 * @throws PersistenceException if the database write itself fails
	 */
	boolean savePinImmediately(Pin pin, String keyword, String sessionId);

	int countPins(String keyword);

	Set<String> getPinIds(String keyword);

	/** Keywords that have pins in this store, in order of their first pin */
	List<String> getKeywords();

	/**
	 * Insert a batch of pins in one transaction, leaving pins whose id is already stored untouched.
	 *
	 * @return the number of pins inserted
	 */
	int insertPinsIfAbsent(List<Pin> pins, String keyword);

	/**
	 * Load pins in insertion order.
	 *
	 * @param limit maximum number of pins, or null for all
	 */
	List<Pin> loadPinsByQuery(String keyword, Integer limit, int offset);

	/** Load a page of pins that carry at least one image URL, in insertion order */
	List<Pin> loadPinsWithImages(String keyword, int limit, int offset);

	long createDownloadTask(String pinId, String imageUrl);

	Optional<DownloadTask> getDownloadTaskByPinAndUrl(String pinId, String imageUrl);

	Optional<DownloadTask> getDownloadTask(long taskId);

	/**
	 * Update a task in one atomic write. A {@code completed} status requires a local path and also
	 * marks the pin downloaded; a {@code failed} status increments the retry count.
	 *
	 * @throws IllegalArgumentException if completed is requested without a path
	 */
	void updateDownloadTaskStatus(
			long taskId, TaskStatus status, String localPath, Long fileSize, String errorMessage);

	List<DownloadTask> getPendingDownloadTasks(int limit);

	int countDownloadTasks(TaskStatus status);

	Optional<CacheMetadata> getCacheMetadata(String keyword);

	@Override
	void close();
}
