package dev.pinharvest.store;

import dev.pinharvest.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * The isolated storage area of one keyword: {@code <output>/<sanitized>/pinterest.db} plus an
 * {@code images} folder next to it.
 */
public record KeywordPartition(String keyword, Path outputDir, String directoryName) {
	public static final String DATABASE_FILE = "pinterest.db";
	public static final String IMAGES_DIR = "images";

	public static KeywordPartition of(Path outputDir, String keywordOrUrl) {
		return new KeywordPartition(keywordOrUrl, outputDir, FileUtils.sanitizeName(keywordOrUrl));
	}

	public Path root() {
		return outputDir.resolve(directoryName);
	}

	public Path databaseFile() {
		return root().resolve(DATABASE_FILE);
	}

	public Path imagesDir() {
		return root().resolve(IMAGES_DIR);
	}

	/** Name used for the per-keyword process lock */
	public String lockName() {
		return directoryName;
	}

	/** Partition directories directly under an output root that hold a database, sorted by name */
	public static List<Path> findPartitionDirectories(Path outputDir) throws IOException {
		if (!Files.isDirectory(outputDir)) {
			return List.of();
		}
		try (Stream<Path> dirs = Files.list(outputDir)) {
			return dirs.filter(dir -> Files.isRegularFile(dir.resolve(DATABASE_FILE)))
					.sorted()
					.toList();
		}
	}
}
