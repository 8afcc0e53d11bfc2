package dev.pinharvest.util;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

	@TempDir
	Path tempDir;

	@Test
	void testSanitizeName_Keyword() {
		assertThat(FileUtils.sanitizeName("cat")).isEqualTo("cat");
		assertThat(FileUtils.sanitizeName("  cute cats  ")).isEqualTo("cute_cats");
		assertThat(FileUtils.sanitizeName("a/b:c*d?e")).isEqualTo("a_b_c_d");
	}

	@Test
	void testSanitizeName_Url() {
		assertThat(FileUtils.sanitizeName("https://www.pinterest.com/ann/cats/")).isEqualTo("cats");
		assertThat(FileUtils.sanitizeName("https://www.pinterest.com/search/pins/?q=cat")).isEqualTo("pins");
	}

	@Test
	void testSanitizeName_Truncates() {
		assertThat(FileUtils.sanitizeName("x".repeat(80))).hasSize(50);
	}

	@Test
	void testSanitizeName_RejectsBlank() {
		assertThatThrownBy(() -> FileUtils.sanitizeName(" ")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testWriteAtomically() throws Exception {
		// Given
		Path target = tempDir.resolve("nested").resolve("p1.jpg");

		// When
		FileUtils.writeAtomically(target, new byte[] {1, 2, 3});
		FileUtils.writeAtomically(target, new byte[] {4, 5});

		// Then
		assertThat(Files.readAllBytes(target)).containsExactly(4, 5);
		assertThat(target.resolveSibling("p1.jpg.part")).doesNotExist();
	}
}
