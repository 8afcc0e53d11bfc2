package dev.pinharvest.store;

import static dev.pinharvest.testing.TestPins.pin;
import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.model.Board;
import dev.pinharvest.model.Creator;
import dev.pinharvest.model.DownloadTask;
import dev.pinharvest.model.Pin;
import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.model.TaskStatus;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqlitePinRepositoryTest {

	@TempDir
	Path tempDir;

	private SqlitePinRepository repository;

	@BeforeEach
	void setUp() {
		repository = SqlitePinRepository.open(KeywordPartition.of(tempDir, "cat"));
	}

	@AfterEach
	void tearDown() {
		repository.close();
	}

	@Test
	void testOpen_CreatesDatabaseInsidePartition() {
		// Then
		assertThat(repository.databaseFile()).isEqualTo(tempDir.resolve("cat").resolve("pinterest.db"));
		assertThat(repository.databaseFile()).exists();
	}

	@Test
	void testSavePinImmediately_IsIdempotent() {
		// Given
		String session = repository.createSession("cat", 10, tempDir.toString(), true);

		// When
		boolean first = repository.savePinImmediately(pin("p1"), "cat", session);
		boolean second = repository.savePinImmediately(pin("p1"), "cat", session);

		// Then
		assertThat(first).isTrue();
		assertThat(second).isFalse();
		assertThat(repository.countPins("cat")).isEqualTo(1);
		assertThat(repository.getSession(session)).get().extracting(ScrapingSession::savedCount).isEqualTo(1);
	}

	@Test
	void testSavePinImmediately_RejectsPinWithoutId() {
		// When
		boolean saved = repository.savePinImmediately(Pin.create().title("no id"), "cat", null);

		// Then
		assertThat(saved).isFalse();
		assertThat(repository.countPins("cat")).isZero();
	}

	@Test
	void testSavePinImmediately_DuplicateFillsMissingFields() {
		// Given
		repository.savePinImmediately(Pin.create().id("p1").imageUrl("original", "https://x/p1.jpg"), "cat", null);

		// When
		repository.savePinImmediately(pin("p1").description("a cat on a mat"), "cat", null);

		// Then
		Pin stored = repository.loadPinsByQuery("cat", null, 0).get(0);
		assertThat(stored.description()).isEqualTo("a cat on a mat");
		assertThat(stored.imageUrls()).containsEntry("original", "https://x/p1.jpg");
	}

	@Test
	void testSavePinImmediately_RoundTripsNestedFields() {
		// Given
		Pin pin = pin("p1")
				.creator(new Creator("Ann", "ann", "42", 7, null))
				.board(new Board("b1", "Cats", "/ann/cats/"))
				.categories(List.of("animals", "cats"))
				.rawData(Map.of("dominant_color", "#fff"));

		// When
		repository.savePinImmediately(pin, "cat", null);

		// Then
		Pin stored = repository.loadPinsByQuery("cat", 1, 0).get(0);
		assertThat(stored.creator().username()).isEqualTo("ann");
		assertThat(stored.creator().followerCount()).isEqualTo(7);
		assertThat(stored.board().name()).isEqualTo("Cats");
		assertThat(stored.categories()).containsExactly("animals", "cats");
		assertThat(stored.rawData()).containsEntry("dominant_color", "#fff");
		assertThat(stored.downloaded()).isFalse();
	}

	@Test
	void testLoadPinsByQuery_KeepsInsertionOrder() {
		// Given
		for (String id : List.of("p3", "p1", "p2")) {
			repository.savePinImmediately(pin(id), "cat", null);
		}

		// When
		List<Pin> all = repository.loadPinsByQuery("cat", null, 0);
		List<Pin> page = repository.loadPinsByQuery("cat", 1, 1);

		// Then
		assertThat(all).extracting(Pin::id).containsExactly("p3", "p1", "p2");
		assertThat(page).extracting(Pin::id).containsExactly("p1");
		assertThat(repository.getPinIds("cat")).containsExactly("p3", "p1", "p2");
	}

	@Test
	void testLoadPinsWithImages_SkipsPinsWithoutImages() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);
		repository.savePinImmediately(Pin.create().id("p2"), "cat", null);

		// When
		List<Pin> withImages = repository.loadPinsWithImages("cat", 10, 0);

		// Then
		assertThat(withImages).extracting(Pin::id).containsExactly("p1");
	}

	@Test
	void testCreateSession_InterruptsPreviousRunningSession() {
		// Given
		String first = repository.createSession("cat", 10, tempDir.toString(), true);

		// When
		String second = repository.createSession("cat", 20, tempDir.toString(), true);

		// Then
		assertThat(repository.getSession(first)).get().extracting(ScrapingSession::status)
				.isEqualTo(SessionStatus.INTERRUPTED);
		assertThat(repository.getSession(second)).get().extracting(ScrapingSession::status)
				.isEqualTo(SessionStatus.RUNNING);
		assertThat(repository.getIncompleteSessions("cat")).extracting(ScrapingSession::id)
				.containsExactly(second, first);
	}

	@Test
	void testUpdateSessionStatus_SetsCompletionTime() {
		// Given
		String session = repository.createSession("cat", 10, tempDir.toString(), true);

		// When
		repository.updateSessionStatus(session, SessionStatus.COMPLETED, 10);

		// Then
		ScrapingSession stored = repository.getSession(session).orElseThrow();
		assertThat(stored.status()).isEqualTo(SessionStatus.COMPLETED);
		assertThat(stored.savedCount()).isEqualTo(10);
		assertThat(stored.completedAt()).isNotNull();
		assertThat(repository.getIncompleteSessions("cat")).isEmpty();
	}

	@Test
	void testResumeSession_MovesInterruptedSessionBackToRunning() {
		// Given
		String session = repository.createSession("cat", 10, tempDir.toString(), true);
		repository.updateSessionStatus(session, SessionStatus.INTERRUPTED, 0);

		// When
		boolean resumed = repository.resumeSession(session);

		// Then
		assertThat(resumed).isTrue();
		assertThat(repository.getSession(session)).get().extracting(ScrapingSession::status)
				.isEqualTo(SessionStatus.RUNNING);
	}

	@Test
	void testCreateDownloadTask_OneTaskPerPinAndUrl() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);

		// When
		long first = repository.createDownloadTask("p1", "https://x/p1.jpg");
		long second = repository.createDownloadTask("p1", "https://x/p1.jpg");

		// Then
		assertThat(second).isEqualTo(first);
		assertThat(repository.countDownloadTasks(TaskStatus.PENDING)).isEqualTo(1);
	}

	@Test
	void testUpdateDownloadTaskStatus_CompletedMarksPinDownloaded() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);
		long task = repository.createDownloadTask("p1", "https://x/p1.jpg");

		// When
		repository.updateDownloadTaskStatus(task, TaskStatus.COMPLETED, "/images/p1.jpg", 2048L, null);

		// Then
		DownloadTask stored = repository.getDownloadTask(task).orElseThrow();
		assertThat(stored.status()).isEqualTo(TaskStatus.COMPLETED);
		assertThat(stored.localPath()).isEqualTo("/images/p1.jpg");
		assertThat(stored.fileSize()).isEqualTo(2048L);
		Pin pin = repository.loadPinsByQuery("cat", null, 0).get(0);
		assertThat(pin.downloaded()).isTrue();
		assertThat(pin.downloadPath()).isEqualTo("/images/p1.jpg");
	}

	@Test
	void testUpdateDownloadTaskStatus_CompletedWithoutPathIsRejected() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);
		long task = repository.createDownloadTask("p1", "https://x/p1.jpg");

		// When/Then
		assertThatThrownBy(() -> repository.updateDownloadTaskStatus(task, TaskStatus.COMPLETED, null, null, null))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(repository.getDownloadTask(task)).get().extracting(DownloadTask::status)
				.isEqualTo(TaskStatus.PENDING);
	}

	@Test
	void testUpdateDownloadTaskStatus_FailedIncrementsRetryCount() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);
		long task = repository.createDownloadTask("p1", "https://x/p1.jpg");

		// When
		repository.updateDownloadTaskStatus(task, TaskStatus.FAILED, null, null, "HTTP 404");
		repository.updateDownloadTaskStatus(task, TaskStatus.FAILED, null, null, "HTTP 404");

		// Then
		DownloadTask stored = repository.getDownloadTask(task).orElseThrow();
		assertThat(stored.retryCount()).isEqualTo(2);
		assertThat(stored.errorMessage()).isEqualTo("HTTP 404");
	}

	@Test
	void testUpdateDownloadTaskStatus_PendingClearsPathAndDownloadedFlag() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);
		long task = repository.createDownloadTask("p1", "https://x/p1.jpg");
		repository.updateDownloadTaskStatus(task, TaskStatus.COMPLETED, "/images/p1.jpg", 2048L, null);

		// When
		repository.updateDownloadTaskStatus(task, TaskStatus.PENDING, null, null, null);

		// Then
		DownloadTask stored = repository.getDownloadTask(task).orElseThrow();
		assertThat(stored.localPath()).isNull();
		assertThat(stored.fileSize()).isNull();
		assertThat(repository.loadPinsByQuery("cat", null, 0).get(0).downloaded()).isFalse();
	}

	@Test
	void testInsertPinsIfAbsent_LeavesExistingPinsUntouched() {
		// Given
		repository.savePinImmediately(pin("p1").title("kept"), "cat", null);

		// When
		int inserted = repository.insertPinsIfAbsent(List.of(pin("p1").title("ignored"), pin("p2")), "cat");

		// Then
		assertThat(inserted).isEqualTo(1);
		assertThat(repository.loadPinsByQuery("cat", null, 0)).extracting(Pin::id, Pin::title)
				.containsExactly(tuple("p1", "kept"), tuple("p2", "Pin p2"));
	}

	@Test
	void testCacheMetadata_TracksPinCount() {
		// Given
		repository.savePinImmediately(pin("p1"), "cat", null);
		repository.savePinImmediately(pin("p2"), "cat", null);

		// When
		CacheMetadata metadata = repository.getCacheMetadata("cat").orElseThrow();

		// Then
		assertThat(metadata.pinCount()).isEqualTo(2);
		assertThat(metadata.lastUpdated()).isNotNull();
		assertThat(repository.getKeywords()).containsExactly("cat");
	}
}
