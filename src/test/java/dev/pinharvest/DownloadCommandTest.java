package dev.pinharvest;

import static dev.pinharvest.testing.TestPins.pin;
import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.lock.FileProcessLock;
import dev.pinharvest.model.TaskStatus;
import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.SqlitePinRepository;
import dev.pinharvest.testing.FakeBrowser;
import dev.pinharvest.testing.ScriptedExtractor;
import dev.pinharvest.testing.StubTransport;
import dev.pinharvest.testing.TestPins;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class DownloadCommandTest {

	@TempDir
	Path tempDir;

	private class FakeDownloadCommand extends DownloadCommand {
		@Override
		PinHarvester createHarvester(HarvesterConfig config) {
			StubTransport transport =
					new StubTransport().otherwise((url, headers) -> StubTransport.ok(TestPins.jpeg(), "image/jpeg"));
			return new PinHarvester(
					config,
					new FakeBrowser().factory(),
					new ScriptedExtractor(),
					transport,
					new FileProcessLock(config.outputDir()),
					d -> {});
		}
	}

	private void store(String keyword, String... ids) {
		try (SqlitePinRepository repository = SqlitePinRepository.open(KeywordPartition.of(tempDir, keyword))) {
			for (String id : ids) {
				repository.savePinImmediately(pin(id), keyword, null);
			}
		}
	}

	@Test
	void testDiscoverKeywords() throws Exception {
		// Given
		store("dog", "d1");
		store("cat", "c1");

		// When/Then
		assertThat(DownloadCommand.discoverKeywords(tempDir)).containsExactly("cat", "dog");
		assertThat(DownloadCommand.discoverKeywords(tempDir.resolve("missing"))).isEmpty();
	}

	@Test
	void testDownload_AllKeywords() {
		// Given
		store("cat", "c1", "c2");
		store("dog", "d1");

		// When
		int exitCode = new CommandLine(new FakeDownloadCommand()).execute("-o", tempDir.toString(), "-t", "2");

		// Then
		assertThat(exitCode).isZero();
		try (SqlitePinRepository repository = SqlitePinRepository.open(KeywordPartition.of(tempDir, "cat"))) {
			assertThat(repository.countDownloadTasks(TaskStatus.COMPLETED)).isEqualTo(2);
		}
		assertThat(tempDir.resolve("dog").resolve("images").resolve("d1.jpg")).exists();
	}

	@Test
	void testDownload_UnknownKeywordFails() {
		// When
		int exitCode = new CommandLine(new FakeDownloadCommand()).execute("-o", tempDir.toString(), "-q", "bird");

		// Then
		assertThat(exitCode).isEqualTo(1);
	}
}
