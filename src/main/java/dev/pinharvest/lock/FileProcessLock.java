package dev.pinharvest.lock;

import dev.pinharvest.util.FileUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessLock} based on OS file locks on {@code <lockDir>/.<name>.lock}. The lock file
 * holds the pid and acquisition time of the owner. The OS drops the lock if the process dies, so
 * a stale file never blocks a later run.
 */
public class FileProcessLock implements ProcessLock {
	private static final Logger logger = LoggerFactory.getLogger(FileProcessLock.class);

	private final Path lockDir;
	private final Map<String, FileLock> held = new ConcurrentHashMap<>();

	public FileProcessLock(Path lockDir) {
		this.lockDir = lockDir;
	}

	public Path lockFile(String name) {
		return lockDir.resolve("." + name + ".lock");
	}

	@Override
	public synchronized boolean acquire(String name) {
		if (held.containsKey(name)) {
			return false;
		}
		Path file = lockFile(name);
		FileChannel channel = null;
		try {
			FileUtils.ensureDirectory(lockDir);
			channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
			FileLock lock = channel.tryLock();
			if (lock == null) {
				channel.close();
				logger.warn("Lock {} is held by another process", file);
				return false;
			}
			channel.truncate(0);
			String owner = "pid=" + ProcessHandle.current().pid() + "\nacquired=" + Instant.now() + "\n";
			channel.write(ByteBuffer.wrap(owner.getBytes(StandardCharsets.UTF_8)));
			channel.force(true);
			held.put(name, lock);
			logger.debug("Acquired lock {}", file);
			return true;
		} catch (OverlappingFileLockException e) {
			closeQuietly(channel);
			logger.warn("Lock {} is already held inside this JVM", file);
			return false;
		} catch (IOException e) {
			closeQuietly(channel);
			throw new UncheckedIOException("Failed to acquire lock " + file, e);
		}
	}

	@Override
	public synchronized void release(String name) {
		FileLock lock = held.remove(name);
		if (lock == null) {
			return;
		}
		Path file = lockFile(name);
		try {
			lock.release();
			lock.channel().close();
			Files.deleteIfExists(file);
			logger.debug("Released lock {}", file);
		} catch (IOException e) {
			logger.warn("Failed to clean up lock file {}: {}", file, e.getMessage());
		}
	}

	private static void closeQuietly(FileChannel channel) {
		if (channel == null) {
			return;
		}
		try {
			channel.close();
		} catch (IOException e) {
			logger.debug("Failed to close lock channel: {}", e.getMessage());
		}
	}
}
