package dev.pinharvest.session;

import static dev.pinharvest.testing.TestPins.pin;
import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.SqlitePinRepository;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionManagerTest {

	@TempDir
	Path tempDir;

	private SqlitePinRepository repository;
	private SessionManager manager;

	@BeforeEach
	void setUp() {
		repository = SqlitePinRepository.open(KeywordPartition.of(tempDir, "cat"));
		manager = new SessionManager(repository, tempDir.toString(), true);
	}

	@AfterEach
	void tearDown() {
		repository.close();
	}

	private void storePins(int count) {
		for (int i = 1; i <= count; i++) {
			repository.savePinImmediately(pin("p" + i), "cat", null);
		}
	}

	@Test
	void testStartOrResume_NewSession() {
		// When
		SessionPlan plan = manager.startOrResume("cat", 5);

		// Then
		assertThat(plan.resumed()).isFalse();
		assertThat(plan.satisfied()).isFalse();
		assertThat(plan.cachedCount()).isZero();
		assertThat(plan.remaining()).isEqualTo(5);
		assertThat(repository.getSession(plan.sessionId())).get().extracting(ScrapingSession::status)
				.isEqualTo(SessionStatus.RUNNING);
	}

	@Test
	void testStartOrResume_ResumesInterruptedSessionForRemainder() {
		// Given
		String previous = repository.createSession("cat", 10, tempDir.toString(), true);
		storePins(7);
		repository.updateSessionStatus(previous, SessionStatus.INTERRUPTED, 7);

		// When
		SessionPlan plan = manager.startOrResume("cat", 10);

		// Then
		assertThat(plan.sessionId()).isEqualTo(previous);
		assertThat(plan.resumed()).isTrue();
		assertThat(plan.cachedCount()).isEqualTo(7);
		assertThat(plan.remaining()).isEqualTo(3);
		assertThat(repository.getSession(previous)).get().extracting(ScrapingSession::status)
				.isEqualTo(SessionStatus.RUNNING);
	}

	@Test
	void testStartOrResume_MismatchedTargetFailsOldSession() {
		// Given
		String previous = repository.createSession("cat", 10, tempDir.toString(), true);
		repository.updateSessionStatus(previous, SessionStatus.INTERRUPTED, 0);

		// When
		SessionPlan plan = manager.startOrResume("cat", 20);

		// Then
		assertThat(plan.sessionId()).isNotEqualTo(previous);
		assertThat(plan.resumed()).isFalse();
		assertThat(repository.getSession(previous)).get().extracting(ScrapingSession::status)
				.isEqualTo(SessionStatus.FAILED);
	}

	@Test
	void testStartOrResume_SatisfiedByCache() {
		// Given
		storePins(5);

		// When
		SessionPlan plan = manager.startOrResume("cat", 3);

		// Then
		assertThat(plan.satisfied()).isTrue();
		assertThat(plan.remaining()).isZero();
		ScrapingSession session = repository.getSession(plan.sessionId()).orElseThrow();
		assertThat(session.status()).isEqualTo(SessionStatus.COMPLETED);
		assertThat(session.savedCount()).isEqualTo(5);
	}

	@Test
	void testInterrupt_RecordsStoredCount() {
		// Given
		SessionPlan plan = manager.startOrResume("cat", 5);
		storePins(2);

		// When
		int saved = manager.interrupt(plan.sessionId(), "cat");

		// Then
		assertThat(saved).isEqualTo(2);
		ScrapingSession session = repository.getSession(plan.sessionId()).orElseThrow();
		assertThat(session.status()).isEqualTo(SessionStatus.INTERRUPTED);
		assertThat(session.savedCount()).isEqualTo(2);
	}
}
