package dev.pinharvest.util;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Utility class for file operations */
public class FileUtils {
	private static final int MAX_NAME_LENGTH = 50;

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Get the size of a file in bytes, or 0 when it doesn't exist */
	public static long getFileSize(Path file) throws IOException {
		return Files.exists(file) ? Files.size(file) : 0L;
	}

	/**
	 * Turn a keyword or URL into a name usable as a directory. Query strings and fragments are
	 * dropped, a URL is reduced to its last path segment, reserved characters become underscores
	 * and the result is at most 50 characters long.
	 */
	public static String sanitizeName(String keywordOrUrl) {
		if (keywordOrUrl == null || keywordOrUrl.isBlank()) {
			throw new IllegalArgumentException("Keyword must not be empty");
		}
		String name = keywordOrUrl.trim();
		int cut = indexOfAny(name, '?', '#');
		if (cut >= 0) {
			name = name.substring(0, cut);
		}
		if (name.startsWith("http://") || name.startsWith("https://")) {
			String path = URI.create(name).getPath();
			if (path != null) {
				String[] segments = path.split("/");
				for (int i = segments.length - 1; i >= 0; i--) {
					if (!segments[i].isEmpty()) {
						name = segments[i];
						break;
					}
				}
			}
		}
		if (name.length() > MAX_NAME_LENGTH) {
			name = name.substring(0, MAX_NAME_LENGTH);
		}
		name = name.replaceAll("[\\\\/:*?\"<>|\\s]", "_");
		return name.isEmpty() ? "_" : name;
	}

	/** Write bytes to a sibling temporary file and move it into place */
	public static void writeAtomically(Path target, byte[] content) throws IOException {
		ensureDirectory(target.toAbsolutePath().getParent());
		Path part = target.resolveSibling(target.getFileName() + ".part");
		try {
			Files.write(part, content);
			try {
				Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (IOException e) {
				Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(part);
		}
	}

	private static int indexOfAny(String s, char... chars) {
		int best = -1;
		for (char c : chars) {
			int idx = s.indexOf(c);
			if (idx >= 0 && (best < 0 || idx < best)) {
				best = idx;
			}
		}
		return best;
	}
}
