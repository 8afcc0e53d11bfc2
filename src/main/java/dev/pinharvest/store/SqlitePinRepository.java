package dev.pinharvest.store;

import dev.pinharvest.model.Board;
import dev.pinharvest.model.Creator;
import dev.pinharvest.model.DownloadTask;
import dev.pinharvest.model.Pin;
import dev.pinharvest.model.PinStats;
import dev.pinharvest.model.ScrapingSession;
import dev.pinharvest.model.SessionStatus;
import dev.pinharvest.model.TaskStatus;
import dev.pinharvest.util.FileUtils;
import dev.pinharvest.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PinRepository} backed by one SQLite file per keyword. A single connection is shared and
 * every public method is synchronized, so each call is one atomic unit as seen by other threads.
 */
public class SqlitePinRepository implements PinRepository {
	private static final Logger logger = LoggerFactory.getLogger(SqlitePinRepository.class);

	private static final List<String> SCHEMA = List.of(
			"""
			CREATE TABLE IF NOT EXISTS pins (
				id TEXT PRIMARY KEY,
				query TEXT NOT NULL,
				title TEXT,
				description TEXT,
				image_urls TEXT,
				largest_image_url TEXT,
				creator TEXT,
				board TEXT,
				categories TEXT,
				stats TEXT,
				url TEXT,
				source_link TEXT,
				downloaded INTEGER NOT NULL DEFAULT 0,
				download_path TEXT,
				raw_data TEXT,
				session_id TEXT,
				created_at TEXT NOT NULL,
				updated_at TEXT NOT NULL
			)""",
			"CREATE INDEX IF NOT EXISTS idx_pins_query ON pins(query)",
			"""
			CREATE TABLE IF NOT EXISTS download_tasks (
				id INTEGER PRIMARY KEY AUTOINCREMENT,
				pin_id TEXT NOT NULL,
				image_url TEXT NOT NULL,
				status TEXT NOT NULL DEFAULT 'pending',
				local_path TEXT,
				file_size INTEGER,
				error_message TEXT,
				retry_count INTEGER NOT NULL DEFAULT 0,
				created_at TEXT NOT NULL,
				updated_at TEXT NOT NULL,
				UNIQUE (pin_id, image_url),
				CHECK (status <> 'completed' OR (local_path IS NOT NULL AND local_path <> ''))
			)""",
			"CREATE INDEX IF NOT EXISTS idx_download_tasks_status ON download_tasks(status)",
			"""
			CREATE TABLE IF NOT EXISTS scraping_sessions (
				id TEXT PRIMARY KEY,
				query TEXT NOT NULL,
				target_count INTEGER NOT NULL,
				output_dir TEXT,
				download_images INTEGER NOT NULL DEFAULT 1,
				status TEXT NOT NULL,
				saved_count INTEGER NOT NULL DEFAULT 0,
				started_at TEXT NOT NULL,
				updated_at TEXT NOT NULL,
				completed_at TEXT
			)""",
			"""
			CREATE UNIQUE INDEX IF NOT EXISTS idx_one_running_session
				ON scraping_sessions(query) WHERE status = 'running'""",
			"""
			CREATE TABLE IF NOT EXISTS cache_metadata (
				query TEXT PRIMARY KEY,
				pin_count INTEGER NOT NULL,
				last_updated TEXT NOT NULL
			)""");

	private static final String PIN_COLUMNS =
			"id, title, description, image_urls, largest_image_url, creator, board, categories, stats,"
					+ " url, source_link, downloaded, download_path, raw_data";
	private static final String TASK_COLUMNS =
			"id, pin_id, image_url, status, local_path, file_size, error_message, retry_count";
	private static final String SESSION_COLUMNS = "id, query, target_count, output_dir, download_images, status,"
			+ " saved_count, started_at, updated_at, completed_at";

	private final Path databaseFile;
	private final Connection connection;

	public SqlitePinRepository(Path databaseFile) {
		this.databaseFile = databaseFile;
		try {
			FileUtils.ensureDirectory(databaseFile.toAbsolutePath().getParent());
			this.connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath());
			try (Statement st = connection.createStatement()) {
				st.execute("PRAGMA journal_mode=WAL");
				st.execute("PRAGMA busy_timeout=10000");
				for (String ddl : SCHEMA) {
					st.execute(ddl);
				}
			}
			logger.debug("Opened database {}", databaseFile);
		} catch (IOException | SQLException e) {
			throw new PersistenceException("Failed to open database " + databaseFile, e);
		}
	}

	/** Open (creating if needed) the database of a keyword partition */
	public static SqlitePinRepository open(KeywordPartition partition) {
		return new SqlitePinRepository(partition.databaseFile());
	}

	public Path databaseFile() {
		return databaseFile;
	}

	// Sessions

	@Override
	public synchronized String createSession(
			String keyword, int targetCount, String outputDir, boolean downloadImages) {
		String id = UUID.randomUUID().toString();
		String now = now();
		return inTransaction(() -> {
			try (PreparedStatement ps = connection.prepareStatement(
					"UPDATE scraping_sessions SET status = 'interrupted', updated_at = ? WHERE query = ? AND status = 'running'")) {
				ps.setString(1, now);
				ps.setString(2, keyword);
				ps.executeUpdate();
			}
			try (PreparedStatement ps = connection.prepareStatement("INSERT INTO scraping_sessions (" + SESSION_COLUMNS
					+ ") VALUES (?, ?, ?, ?, ?, 'running', ?, ?, ?, NULL)")) {
				ps.setString(1, id);
				ps.setString(2, keyword);
				ps.setInt(3, targetCount);
				ps.setString(4, outputDir);
				ps.setInt(5, downloadImages ? 1 : 0);
				ps.setInt(6, countPinsInternal(keyword));
				ps.setString(7, now);
				ps.setString(8, now);
				ps.executeUpdate();
			}
			return id;
		});
	}

	@Override
	public synchronized List<ScrapingSession> getIncompleteSessions(String keyword) {
		return query(
				"SELECT " + SESSION_COLUMNS + " FROM scraping_sessions WHERE query = ?"
						+ " AND status IN ('running', 'interrupted') ORDER BY rowid DESC",
				ps -> ps.setString(1, keyword),
				SqlitePinRepository::mapSession);
	}

	@Override
	public synchronized List<ScrapingSession> getSessions(String keyword) {
		return query(
				"SELECT " + SESSION_COLUMNS + " FROM scraping_sessions WHERE query = ? ORDER BY rowid DESC",
				ps -> ps.setString(1, keyword),
				SqlitePinRepository::mapSession);
	}

	@Override
	public synchronized Optional<ScrapingSession> getSession(String sessionId) {
		return query(
						"SELECT " + SESSION_COLUMNS + " FROM scraping_sessions WHERE id = ?",
						ps -> ps.setString(1, sessionId),
						SqlitePinRepository::mapSession)
				.stream()
				.findFirst();
	}

	@Override
	public synchronized boolean resumeSession(String sessionId) {
		String now = now();
		return inTransaction(() -> {
			String keyword = null;
			try (PreparedStatement ps = connection.prepareStatement(
					"SELECT query FROM scraping_sessions WHERE id = ? AND status IN ('running', 'interrupted')")) {
				ps.setString(1, sessionId);
				try (ResultSet rs = ps.executeQuery()) {
					if (rs.next()) {
						keyword = rs.getString(1);
					}
				}
			}
			if (keyword == null) {
				return false;
			}
			try (PreparedStatement ps = connection.prepareStatement(
					"UPDATE scraping_sessions SET status = 'interrupted', updated_at = ?"
							+ " WHERE query = ? AND status = 'running' AND id <> ?")) {
				ps.setString(1, now);
				ps.setString(2, keyword);
				ps.setString(3, sessionId);
				ps.executeUpdate();
			}
			try (PreparedStatement ps = connection.prepareStatement(
					"UPDATE scraping_sessions SET status = 'running', completed_at = NULL, updated_at = ? WHERE id = ?")) {
				ps.setString(1, now);
				ps.setString(2, sessionId);
				return ps.executeUpdate() == 1;
			}
		});
	}

	@Override
	public synchronized void updateSessionStatus(String sessionId, SessionStatus status, int savedCount) {
		String now = now();
		update(
				"UPDATE scraping_sessions SET status = ?, saved_count = ?, updated_at = ?,"
						+ " completed_at = CASE WHEN ? THEN ? ELSE completed_at END WHERE id = ?",
				ps -> {
					ps.setString(1, status.value());
					ps.setInt(2, savedCount);
					ps.setString(3, now);
					ps.setBoolean(4, status.isTerminal());
					ps.setString(5, now);
					ps.setString(6, sessionId);
				});
	}

	// Pins

	@Override
	public synchronized boolean savePinImmediately(Pin pin, String keyword, String sessionId) {
		if (pin == null || pin.id() == null || pin.id().isBlank()) {
			logger.debug("Rejected pin without id");
			return false;
		}
		String now = now();
		return inTransaction(() -> {
			boolean inserted;
			try (PreparedStatement ps = connection.prepareStatement("INSERT INTO pins (" + PIN_COLUMNS
					+ ", query, session_id, created_at, updated_at)"
					+ " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT(id) DO NOTHING")) {
				bindPin(ps, pin);
				ps.setString(15, keyword);
				ps.setString(16, sessionId);
				ps.setString(17, now);
				ps.setString(18, now);
				inserted = ps.executeUpdate() == 1;
			}
			if (!inserted) {
				refreshPin(pin, now);
				return false;
			}
			try (PreparedStatement ps = connection.prepareStatement(
					"INSERT INTO cache_metadata (query, pin_count, last_updated) VALUES (?, ?, ?)"
							+ " ON CONFLICT(query) DO UPDATE SET pin_count = excluded.pin_count,"
							+ " last_updated = excluded.last_updated")) {
				ps.setString(1, keyword);
				ps.setInt(2, countPinsInternal(keyword));
				ps.setString(3, now);
				ps.executeUpdate();
			}
			if (sessionId != null) {
				try (PreparedStatement ps = connection.prepareStatement(
						"UPDATE scraping_sessions SET saved_count = ?, updated_at = ? WHERE id = ?")) {
					ps.setInt(1, countPinsInternal(keyword));
					ps.setString(2, now);
					ps.setString(3, sessionId);
					ps.executeUpdate();
				}
			}
			return true;
		});
	}

	// A later sighting may carry fields the first extraction missed
	private void refreshPin(Pin pin, String now) throws SQLException {
		try (PreparedStatement ps = connection.prepareStatement(
				"""
				UPDATE pins SET
					title = COALESCE(?, title),
					description = COALESCE(?, description),
					largest_image_url = COALESCE(largest_image_url, ?),
					source_link = COALESCE(?, source_link),
					updated_at = ?
				WHERE id = ?""")) {
			ps.setString(1, blankToNull(pin.title()));
			ps.setString(2, blankToNull(pin.description()));
			ps.setString(3, blankToNull(pin.largestImageUrl()));
			ps.setString(4, blankToNull(pin.sourceLink()));
			ps.setString(5, now);
			ps.setString(6, pin.id());
			ps.executeUpdate();
		}
	}

	@Override
	public synchronized int countPins(String keyword) {
		try {
			return countPinsInternal(keyword);
		} catch (SQLException e) {
			throw new PersistenceException("Failed to count pins for " + keyword, e);
		}
	}

	@Override
	public synchronized Set<String> getPinIds(String keyword) {
		return new LinkedHashSet<>(query(
				"SELECT id FROM pins WHERE query = ? ORDER BY rowid",
				ps -> ps.setString(1, keyword),
				rs -> rs.getString(1)));
	}

	@Override
	public synchronized List<String> getKeywords() {
		return query(
				"SELECT query FROM pins GROUP BY query ORDER BY MIN(rowid)", ps -> {}, rs -> rs.getString(1));
	}

	@Override
	public synchronized int insertPinsIfAbsent(List<Pin> pins, String keyword) {
		if (pins.isEmpty()) {
			return 0;
		}
		String now = now();
		return inTransaction(() -> {
			int inserted = 0;
			try (PreparedStatement ps = connection.prepareStatement("INSERT INTO pins (" + PIN_COLUMNS
					+ ", query, session_id, created_at, updated_at)"
					+ " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NULL, ?, ?) ON CONFLICT(id) DO NOTHING")) {
				for (Pin pin : pins) {
					if (pin.id() == null || pin.id().isBlank()) {
						continue;
					}
					bindPin(ps, pin);
					ps.setString(15, keyword);
					ps.setString(16, now);
					ps.setString(17, now);
					inserted += ps.executeUpdate();
				}
			}
			if (inserted > 0) {
				try (PreparedStatement ps = connection.prepareStatement(
						"INSERT INTO cache_metadata (query, pin_count, last_updated) VALUES (?, ?, ?)"
								+ " ON CONFLICT(query) DO UPDATE SET pin_count = excluded.pin_count,"
								+ " last_updated = excluded.last_updated")) {
					ps.setString(1, keyword);
					ps.setInt(2, countPinsInternal(keyword));
					ps.setString(3, now);
					ps.executeUpdate();
				}
			}
			return inserted;
		});
	}

	@Override
	public synchronized List<Pin> loadPinsByQuery(String keyword, Integer limit, int offset) {
		return query(
				"SELECT " + PIN_COLUMNS + " FROM pins WHERE query = ? ORDER BY rowid LIMIT ? OFFSET ?",
				ps -> {
					ps.setString(1, keyword);
					ps.setInt(2, limit != null ? limit : -1);
					ps.setInt(3, Math.max(0, offset));
				},
				SqlitePinRepository::mapPin);
	}

	@Override
	public synchronized List<Pin> loadPinsWithImages(String keyword, int limit, int offset) {
		return query(
				"SELECT " + PIN_COLUMNS + " FROM pins WHERE query = ?"
						+ " AND ((largest_image_url IS NOT NULL AND largest_image_url <> '')"
						+ " OR (image_urls IS NOT NULL AND image_urls NOT IN ('', '{}', 'null')))"
						+ " ORDER BY rowid LIMIT ? OFFSET ?",
				ps -> {
					ps.setString(1, keyword);
					ps.setInt(2, limit);
					ps.setInt(3, Math.max(0, offset));
				},
				SqlitePinRepository::mapPin);
	}

	// Download tasks

	@Override
	public synchronized long createDownloadTask(String pinId, String imageUrl) {
		String now = now();
		return inTransaction(() -> {
			try (PreparedStatement ps = connection.prepareStatement(
					"INSERT INTO download_tasks (pin_id, image_url, status, created_at, updated_at)"
							+ " VALUES (?, ?, 'pending', ?, ?) ON CONFLICT(pin_id, image_url) DO NOTHING")) {
				ps.setString(1, pinId);
				ps.setString(2, imageUrl);
				ps.setString(3, now);
				ps.setString(4, now);
				ps.executeUpdate();
			}
			try (PreparedStatement ps = connection.prepareStatement(
					"SELECT id FROM download_tasks WHERE pin_id = ? AND image_url = ?")) {
				ps.setString(1, pinId);
				ps.setString(2, imageUrl);
				try (ResultSet rs = ps.executeQuery()) {
					rs.next();
					return rs.getLong(1);
				}
			}
		});
	}

	@Override
	public synchronized Optional<DownloadTask> getDownloadTaskByPinAndUrl(String pinId, String imageUrl) {
		return query(
						"SELECT " + TASK_COLUMNS + " FROM download_tasks WHERE pin_id = ? AND image_url = ?",
						ps -> {
							ps.setString(1, pinId);
							ps.setString(2, imageUrl);
						},
						SqlitePinRepository::mapTask)
				.stream()
				.findFirst();
	}

	@Override
	public synchronized Optional<DownloadTask> getDownloadTask(long taskId) {
		return query(
						"SELECT " + TASK_COLUMNS + " FROM download_tasks WHERE id = ?",
						ps -> ps.setLong(1, taskId),
						SqlitePinRepository::mapTask)
				.stream()
				.findFirst();
	}

	@Override
	public synchronized void updateDownloadTaskStatus(
			long taskId, TaskStatus status, String localPath, Long fileSize, String errorMessage) {
		if (status == TaskStatus.COMPLETED && (localPath == null || localPath.isBlank())) {
			throw new IllegalArgumentException("A completed download task needs a local path (task " + taskId + ")");
		}
		String now = now();
		inTransaction(() -> {
			try (PreparedStatement ps = connection.prepareStatement(
					"""
					UPDATE download_tasks SET
						status = ?,
						local_path = CASE WHEN ? THEN NULL ELSE COALESCE(?, local_path) END,
						file_size = CASE WHEN ? THEN NULL ELSE COALESCE(?, file_size) END,
						error_message = ?,
						retry_count = retry_count + ?,
						updated_at = ?
					WHERE id = ?""")) {
				boolean reset = status == TaskStatus.PENDING;
				ps.setString(1, status.value());
				ps.setBoolean(2, reset);
				ps.setString(3, localPath);
				ps.setBoolean(4, reset);
				if (fileSize != null) {
					ps.setLong(5, fileSize);
				} else {
					ps.setNull(5, Types.INTEGER);
				}
				ps.setString(6, errorMessage);
				ps.setInt(7, status == TaskStatus.FAILED ? 1 : 0);
				ps.setString(8, now);
				ps.setLong(9, taskId);
				if (ps.executeUpdate() != 1) {
					throw new SQLException("No download task with id " + taskId);
				}
			}
			if (status == TaskStatus.COMPLETED || status == TaskStatus.PENDING) {
				try (PreparedStatement ps = connection.prepareStatement(
						"UPDATE pins SET downloaded = ?, download_path = ?, updated_at = ?"
								+ " WHERE id = (SELECT pin_id FROM download_tasks WHERE id = ?)")) {
					ps.setInt(1, status == TaskStatus.COMPLETED ? 1 : 0);
					ps.setString(2, status == TaskStatus.COMPLETED ? localPath : null);
					ps.setString(3, now);
					ps.setLong(4, taskId);
					ps.executeUpdate();
				}
			}
			return null;
		});
	}

	@Override
	public synchronized List<DownloadTask> getPendingDownloadTasks(int limit) {
		return query(
				"SELECT " + TASK_COLUMNS + " FROM download_tasks WHERE status = 'pending' ORDER BY id LIMIT ?",
				ps -> ps.setInt(1, limit),
				SqlitePinRepository::mapTask);
	}

	@Override
	public synchronized int countDownloadTasks(TaskStatus status) {
		return query(
						"SELECT COUNT(*) FROM download_tasks WHERE status = ?",
						ps -> ps.setString(1, status.value()),
						rs -> rs.getInt(1))
				.get(0);
	}

	@Override
	public synchronized Optional<CacheMetadata> getCacheMetadata(String keyword) {
		return query(
						"SELECT query, pin_count, last_updated FROM cache_metadata WHERE query = ?",
						ps -> ps.setString(1, keyword),
						rs -> new CacheMetadata(
								rs.getString(1), rs.getInt(2), Instant.parse(rs.getString(3))))
				.stream()
				.findFirst();
	}

	@Override
	public synchronized void close() {
		try {
			connection.close();
			logger.debug("Closed database {}", databaseFile);
		} catch (SQLException e) {
			throw new PersistenceException("Failed to close database " + databaseFile, e);
		}
	}

	// JDBC plumbing

	@FunctionalInterface
	private interface SqlWork<T> {
		T run() throws SQLException;
	}

	@FunctionalInterface
	private interface Binder {
		void bind(PreparedStatement ps) throws SQLException;
	}

	@FunctionalInterface
	private interface RowMapper<T> {
		T map(ResultSet rs) throws SQLException;
	}

	private <T> T inTransaction(SqlWork<T> work) {
		try {
			connection.setAutoCommit(false);
			try {
				T result = work.run();
				connection.commit();
				return result;
			} catch (SQLException | RuntimeException e) {
				connection.rollback();
				throw e;
			} finally {
				connection.setAutoCommit(true);
			}
		} catch (SQLException e) {
			throw new PersistenceException("Database transaction failed on " + databaseFile, e);
		}
	}

	private void update(String sql, Binder binder) {
		try (PreparedStatement ps = connection.prepareStatement(sql)) {
			binder.bind(ps);
			ps.executeUpdate();
		} catch (SQLException e) {
			throw new PersistenceException("Database update failed on " + databaseFile, e);
		}
	}

	private <T> List<T> query(String sql, Binder binder, RowMapper<T> mapper) {
		try (PreparedStatement ps = connection.prepareStatement(sql)) {
			binder.bind(ps);
			try (ResultSet rs = ps.executeQuery()) {
				List<T> rows = new ArrayList<>();
				while (rs.next()) {
					rows.add(mapper.map(rs));
				}
				return rows;
			}
		} catch (SQLException e) {
			throw new PersistenceException("Database query failed on " + databaseFile, e);
		}
	}

	private int countPinsInternal(String keyword) throws SQLException {
		try (PreparedStatement ps = connection.prepareStatement("SELECT COUNT(*) FROM pins WHERE query = ?")) {
			ps.setString(1, keyword);
			try (ResultSet rs = ps.executeQuery()) {
				return rs.next() ? rs.getInt(1) : 0;
			}
		}
	}

	private static void bindPin(PreparedStatement ps, Pin pin) throws SQLException {
		ps.setString(1, pin.id());
		ps.setString(2, pin.title());
		ps.setString(3, pin.description());
		ps.setString(4, JsonUtils.toJson(pin.imageUrls()));
		ps.setString(5, pin.largestImageUrl());
		ps.setString(6, JsonUtils.toJson(pin.creator()));
		ps.setString(7, JsonUtils.toJson(pin.board()));
		ps.setString(8, JsonUtils.toJson(pin.categories()));
		ps.setString(9, JsonUtils.toJson(pin.stats()));
		ps.setString(10, pin.url());
		ps.setString(11, pin.sourceLink());
		ps.setInt(12, pin.downloaded() ? 1 : 0);
		ps.setString(13, pin.downloadPath());
		ps.setString(14, JsonUtils.toJson(pin.rawData()));
	}

	private static Pin mapPin(ResultSet rs) throws SQLException {
		return Pin.create()
				.id(rs.getString("id"))
				.title(rs.getString("title"))
				.description(rs.getString("description"))
				.imageUrls(JsonUtils.readStringMap(rs.getString("image_urls")))
				.largestImageUrl(rs.getString("largest_image_url"))
				.creator(JsonUtils.fromJson(rs.getString("creator"), Creator.class))
				.board(JsonUtils.fromJson(rs.getString("board"), Board.class))
				.categories(JsonUtils.readStringList(rs.getString("categories")))
				.stats(JsonUtils.fromJson(rs.getString("stats"), PinStats.class))
				.url(rs.getString("url"))
				.sourceLink(rs.getString("source_link"))
				.downloaded(rs.getInt("downloaded") != 0)
				.downloadPath(rs.getString("download_path"))
				.rawData(JsonUtils.readMap(rs.getString("raw_data")));
	}

	private static DownloadTask mapTask(ResultSet rs) throws SQLException {
		long size = rs.getLong("file_size");
		Long fileSize = rs.wasNull() ? null : size;
		return new DownloadTask(
				rs.getLong("id"),
				rs.getString("pin_id"),
				rs.getString("image_url"),
				TaskStatus.fromValue(rs.getString("status")),
				rs.getString("local_path"),
				fileSize,
				rs.getString("error_message"),
				rs.getInt("retry_count"));
	}

	private static ScrapingSession mapSession(ResultSet rs) throws SQLException {
		String completedAt = rs.getString("completed_at");
		return new ScrapingSession(
				rs.getString("id"),
				rs.getString("query"),
				rs.getInt("target_count"),
				rs.getString("output_dir"),
				rs.getInt("download_images") != 0,
				SessionStatus.fromValue(rs.getString("status")),
				rs.getInt("saved_count"),
				Instant.parse(rs.getString("started_at")),
				Instant.parse(rs.getString("updated_at")),
				completedAt != null ? Instant.parse(completedAt) : null);
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value;
	}

	private static String now() {
		return Instant.now().toString();
	}
}
