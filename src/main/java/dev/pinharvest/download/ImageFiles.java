package dev.pinharvest.download;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Checks on downloaded image files and the layout of the images folder */
public class ImageFiles {
	/** Files below this size are treated as broken downloads */
	public static final long MIN_SIZE = 1024;

	private static final Set<String> EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp");
	private static final String DEFAULT_EXTENSION = "jpg";

	public enum Format {
		JPEG,
		PNG,
		GIF,
		WEBP
	}

	/** Detect the image format from the leading bytes of a file or response body */
	public static Optional<Format> detectFormat(byte[] header) {
		if (header == null) {
			return Optional.empty();
		}
		if (startsWith(header, 0xFF, 0xD8, 0xFF)) {
			return Optional.of(Format.JPEG);
		}
		if (startsWith(header, 0x89, 0x50, 0x4E, 0x47)) {
			return Optional.of(Format.PNG);
		}
		if (startsWith(header, 'G', 'I', 'F', '8')) {
			return Optional.of(Format.GIF);
		}
		if (header.length >= 12
				&& startsWith(header, 'R', 'I', 'F', 'F')
				&& header[8] == 'W'
				&& header[9] == 'E'
				&& header[10] == 'B'
				&& header[11] == 'P') {
			return Optional.of(Format.WEBP);
		}
		return Optional.empty();
	}

	/** True if the file exists, reaches the size floor and starts with known image magic bytes */
	public static boolean isValidImage(Path file) {
		try {
			if (!Files.isRegularFile(file) || Files.size(file) < MIN_SIZE) {
				return false;
			}
			byte[] header = new byte[12];
			int read;
			try (InputStream in = Files.newInputStream(file)) {
				read = in.readNBytes(header, 0, header.length);
			}
			return read >= 3 && detectFormat(header).isPresent();
		} catch (IOException e) {
			return false;
		}
	}

	/** File extension of an image URL, {@code jpg} when the path doesn't end in a known one */
	public static String extensionOf(String url) {
		String path;
		try {
			path = URI.create(url).getPath();
		} catch (IllegalArgumentException e) {
			path = url;
		}
		if (path != null) {
			int dot = path.lastIndexOf('.');
			if (dot >= 0 && dot > path.lastIndexOf('/')) {
				String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
				if (EXTENSIONS.contains(ext)) {
					return ext;
				}
			}
		}
		return DEFAULT_EXTENSION;
	}

	/** Deterministic location of the image of a pin: {@code <imagesDir>/<pinId>.<ext>} */
	public static Path expectedPath(Path imagesDir, String pinId, String canonicalUrl) {
		return imagesDir.resolve(pinId + "." + extensionOf(canonicalUrl));
	}

	private static boolean startsWith(byte[] data, int... prefix) {
		if (data.length < prefix.length) {
			return false;
		}
		for (int i = 0; i < prefix.length; i++) {
			if ((data[i] & 0xFF) != prefix[i]) {
				return false;
			}
		}
		return true;
	}
}
