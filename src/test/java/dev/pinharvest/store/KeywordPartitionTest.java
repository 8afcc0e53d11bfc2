package dev.pinharvest.store;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeywordPartitionTest {

	@TempDir
	Path tempDir;

	@Test
	void testLayout() {
		// When
		KeywordPartition partition = KeywordPartition.of(tempDir, "cute cats");

		// Then
		assertThat(partition.keyword()).isEqualTo("cute cats");
		assertThat(partition.root()).isEqualTo(tempDir.resolve("cute_cats"));
		assertThat(partition.databaseFile()).isEqualTo(tempDir.resolve("cute_cats").resolve("pinterest.db"));
		assertThat(partition.imagesDir()).isEqualTo(tempDir.resolve("cute_cats").resolve("images"));
		assertThat(partition.lockName()).isEqualTo("cute_cats");
	}

	@Test
	void testFindPartitionDirectories() throws Exception {
		// Given
		Files.createDirectories(tempDir.resolve("dog"));
		Files.createFile(tempDir.resolve("dog").resolve(KeywordPartition.DATABASE_FILE));
		Files.createDirectories(tempDir.resolve("cat"));
		Files.createFile(tempDir.resolve("cat").resolve(KeywordPartition.DATABASE_FILE));
		Files.createDirectories(tempDir.resolve("empty"));

		// When/Then
		assertThat(KeywordPartition.findPartitionDirectories(tempDir))
				.containsExactly(tempDir.resolve("cat"), tempDir.resolve("dog"));
		assertThat(KeywordPartition.findPartitionDirectories(tempDir.resolve("missing"))).isEmpty();
	}
}
