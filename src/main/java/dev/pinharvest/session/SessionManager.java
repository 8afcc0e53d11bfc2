package dev.pinharvest.session;

import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.store.PinRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the session lifecycle of one keyword: decides between a new run, a resumed run and a run
 * that is already satisfied by stored pins, and records the final status with the count read back
 * from the store.
 */
public class SessionManager {
	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	private final PinRepository repository;
	private final String outputDir;
	private final boolean downloadImages;

	public SessionManager(PinRepository repository, String outputDir, boolean downloadImages) {
		this.repository = repository;
		this.outputDir = outputDir;
		this.downloadImages = downloadImages;
	}

	public SessionPlan startOrResume(String keyword, int targetCount) {
		int cached = repository.countPins(keyword);
		List<ScrapingSession> incomplete = repository.getIncompleteSessions(keyword);

		if (cached >= targetCount) {
			String sessionId;
			if (!incomplete.isEmpty()) {
				sessionId = incomplete.get(0).id();
				repository.resumeSession(sessionId);
			} else {
				sessionId = repository.createSession(keyword, targetCount, outputDir, downloadImages);
			}
			repository.updateSessionStatus(sessionId, SessionStatus.COMPLETED, cached);
			logger.info("Found {} cached pins for '{}', target of {} already met", cached, keyword, targetCount);
			return new SessionPlan(sessionId, cached, 0, false, true);
		}

		int remaining = targetCount - cached;
		if (!incomplete.isEmpty()) {
			ScrapingSession previous = incomplete.get(0);
			try {
				verify(previous, keyword, targetCount);
				if (repository.resumeSession(previous.id())) {
					logger.info(
							"Resuming session {} for '{}': {} pins stored, {} more needed",
							previous.id(),
							keyword,
							cached,
							remaining);
					return new SessionPlan(previous.id(), cached, remaining, true, false);
				}
			} catch (SessionMismatchException e) {
				logger.warn("Discarding session {}: {}", previous.id(), e.getMessage());
				repository.updateSessionStatus(previous.id(), SessionStatus.FAILED, cached);
			}
		}

		String sessionId = repository.createSession(keyword, targetCount, outputDir, downloadImages);
		logger.info("Started session {} for '{}': {} pins stored, {} more needed", sessionId, keyword, cached, remaining);
		return new SessionPlan(sessionId, cached, remaining, false, false);
	}

	/** Mark the session completed with the stored pin count */
	public int complete(String sessionId, String keyword) {
		return finish(sessionId, keyword, SessionStatus.COMPLETED);
	}

	/** Mark the session interrupted with the stored pin count */
	public int interrupt(String sessionId, String keyword) {
		return finish(sessionId, keyword, SessionStatus.INTERRUPTED);
	}

	/** Mark the session failed with the stored pin count */
	public int fail(String sessionId, String keyword) {
		return finish(sessionId, keyword, SessionStatus.FAILED);
	}

	private int finish(String sessionId, String keyword, SessionStatus status) {
		int saved = repository.countPins(keyword);
		repository.updateSessionStatus(sessionId, status, saved);
		logger.info("Session {} for '{}' is now {} with {} pins", sessionId, keyword, status.value(), saved);
		return saved;
	}

	private static void verify(ScrapingSession session, String keyword, int targetCount)
			throws SessionMismatchException {
		if (!session.keyword().equals(keyword)) {
			throw new SessionMismatchException(
					"stored keyword '" + session.keyword() + "' differs from '" + keyword + "'");
		}
		if (session.targetCount() != targetCount) {
			throw new SessionMismatchException(
					"stored target " + session.targetCount() + " differs from requested " + targetCount);
		}
	}
}
