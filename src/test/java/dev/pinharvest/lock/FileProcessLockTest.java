package dev.pinharvest.lock;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileProcessLockTest {

	@TempDir
	Path tempDir;

	@Test
	void testAcquire_WritesOwnerIntoLockFile() throws Exception {
		// Given
		FileProcessLock lock = new FileProcessLock(tempDir);

		// When
		boolean acquired = lock.acquire("cat");

		// Then
		assertThat(acquired).isTrue();
		assertThat(lock.lockFile("cat")).isEqualTo(tempDir.resolve(".cat.lock"));
		assertThat(Files.readString(lock.lockFile("cat"))).contains("pid=" + ProcessHandle.current().pid());
		lock.release("cat");
	}

	@Test
	void testAcquire_SecondHolderIsRefused() {
		// Given
		FileProcessLock first = new FileProcessLock(tempDir);
		FileProcessLock second = new FileProcessLock(tempDir);
		first.acquire("cat");

		// When
		boolean sameInstance = first.acquire("cat");
		boolean otherInstance = second.acquire("cat");

		// Then
		assertThat(sameInstance).isFalse();
		assertThat(otherInstance).isFalse();
		first.release("cat");
	}

	@Test
	void testAcquire_DifferentNamesDoNotContend() {
		// Given
		FileProcessLock lock = new FileProcessLock(tempDir);

		// When/Then
		assertThat(lock.acquire("cat")).isTrue();
		assertThat(lock.acquire("dog")).isTrue();
		lock.release("cat");
		lock.release("dog");
	}

	@Test
	void testRelease_AllowsReacquireAndRemovesFile() {
		// Given
		FileProcessLock lock = new FileProcessLock(tempDir);
		lock.acquire("cat");

		// When
		lock.release("cat");

		// Then
		assertThat(lock.lockFile("cat")).doesNotExist();
		assertThat(new FileProcessLock(tempDir).acquire("cat")).isTrue();
	}

	@Test
	void testRelease_UnknownNameIsNoOp() {
		// Given
		FileProcessLock lock = new FileProcessLock(tempDir);

		// When/Then
		assertThatCode(() -> lock.release("never-held")).doesNotThrowAnyException();
	}
}
