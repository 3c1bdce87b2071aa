package queuectl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SQLite-backed job table. Every worker process opens its own connections against the same file,
 * so the database lock is the only cross-process synchronization the queue has.
 *
 * <p>Timestamps are stored as epoch milliseconds. Ties on {@code created_at} fall back to rowid,
 * i.e. insertion order.
 */
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private static final String COLUMNS =
        "id, command, state, attempts, retry_limit, created_at, updated_at, next_run_at, last_error";

    private final String url;
    private final SQLiteConfig sqliteConfig;
    private final Clock clock;

    public JobStore(Path databaseFile, int busyTimeoutMillis, Clock clock) {
        Objects.requireNonNull(databaseFile, "databaseFile must not be null");
        this.url = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setJournalMode(SQLiteConfig.JournalMode.WAL);
        cfg.setBusyTimeout(busyTimeoutMillis);
        // BEGIN IMMEDIATE takes the write lock up front, so select + conditional update is one critical section.
        cfg.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.sqliteConfig = cfg;
    }

    public JobStore(Path databaseFile, int busyTimeoutMillis) {
        this(databaseFile, busyTimeoutMillis, Clock.systemUTC());
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, sqliteConfig.toProperties());
    }

    public void init() {
        String jobsTable = """
            CREATE TABLE IF NOT EXISTS jobs (
                id TEXT PRIMARY KEY,
                command TEXT NOT NULL,
                state TEXT NOT NULL DEFAULT 'pending',
                attempts INTEGER NOT NULL DEFAULT 0,
                retry_limit INTEGER NOT NULL DEFAULT 3,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                next_run_at INTEGER DEFAULT NULL,
                last_error TEXT DEFAULT NULL
            );
            """;
        String claimIndex = "CREATE INDEX IF NOT EXISTS idx_jobs_pending_next_run ON jobs (state, next_run_at)";

        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(jobsTable);
            stmt.execute(claimIndex);
        } catch (SQLException e) {
            throw new JobStoreException("Database init error: " + e.getMessage(), e);
        }
    }

    /**
     * Inserts a new pending job.
     *
     * @throws DuplicateJobException if a job with the same id exists; the existing row is untouched
     */
    public Job insert(String id, String command, int retryLimit) {
        Instant now = clock.instant();
        String sql = "INSERT INTO jobs (id, command, state, attempts, retry_limit, created_at, updated_at, next_run_at) "
            + "VALUES (?, ?, ?, 0, ?, ?, ?, NULL)";

        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, id);
            pstmt.setString(2, command);
            pstmt.setString(3, JobState.PENDING.dbValue());
            pstmt.setInt(4, retryLimit);
            pstmt.setLong(5, now.toEpochMilli());
            pstmt.setLong(6, now.toEpochMilli());
            pstmt.executeUpdate();
        } catch (SQLException e) {
            if (hasCode(e, SQLiteErrorCode.SQLITE_CONSTRAINT)) {
                throw new DuplicateJobException(id, e);
            }
            throw new JobStoreException("Error enqueuing job " + id + ": " + e.getMessage(), e);
        }
        return new Job(id, command, JobState.PENDING, 0, retryLimit,
            truncateToMillis(now), truncateToMillis(now), null, null);
    }

    /**
     * Atomically moves the oldest eligible pending job to processing and returns it.
     *
     * @return the claimed job, or null when nothing is eligible, another worker won the race,
     * or the database is busy
     */
    public Job claimNext() {
        String selectSql = "SELECT id FROM jobs WHERE state = ? AND (next_run_at IS NULL OR next_run_at <= ?) "
            + "ORDER BY created_at ASC, rowid ASC LIMIT 1";
        String updateSql = "UPDATE jobs SET state = ?, updated_at = ? WHERE id = ? AND state = ?";
        String fetchSql = "SELECT " + COLUMNS + " FROM jobs WHERE id = ?";

        long now = clock.millis();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                String id;
                try (PreparedStatement sel = conn.prepareStatement(selectSql)) {
                    sel.setString(1, JobState.PENDING.dbValue());
                    sel.setLong(2, now);
                    try (ResultSet rs = sel.executeQuery()) {
                        if (!rs.next()) {
                            conn.commit();
                            return null;
                        }
                        id = rs.getString("id");
                    }
                }

                try (PreparedStatement upd = conn.prepareStatement(updateSql)) {
                    upd.setString(1, JobState.PROCESSING.dbValue());
                    upd.setLong(2, now);
                    upd.setString(3, id);
                    upd.setString(4, JobState.PENDING.dbValue());
                    if (upd.executeUpdate() != 1) {
                        conn.rollback();
                        return null;
                    }
                }

                Job job;
                try (PreparedStatement fetch = conn.prepareStatement(fetchSql)) {
                    fetch.setString(1, id);
                    try (ResultSet rs = fetch.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return null;
                        }
                        job = mapRowToJob(rs);
                    }
                }

                conn.commit();
                return job;
            } catch (SQLException ex) {
                rollback(conn, ex);
                throw ex;
            }
        } catch (SQLException e) {
            if (isBusy(e)) {
                log.debug("Database busy during claim, treating as empty poll: {}", e.getMessage());
                return null;
            }
            throw new JobStoreException("Error claiming job: " + e.getMessage(), e);
        }
    }

    /**
     * Writes only the state (plus updated_at). Used for completion.
     */
    public void updateStatus(String id, JobState state) {
        String sql = "UPDATE jobs SET state = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, state.dbValue());
            pstmt.setLong(2, clock.millis());
            pstmt.setString(3, id);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Error updating job " + id + " to " + state.dbValue() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Unconditional write of the failure-handling fields plus updated_at.
     */
    public void updateStatus(String id, JobState state, int attempts, Instant nextRunAt, String lastError) {
        String sql = "UPDATE jobs SET state = ?, attempts = ?, next_run_at = ?, last_error = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, state.dbValue());
            pstmt.setInt(2, attempts);
            if (nextRunAt != null) {
                pstmt.setLong(3, nextRunAt.toEpochMilli());
            } else {
                pstmt.setNull(3, Types.INTEGER);
            }
            pstmt.setString(4, lastError);
            pstmt.setLong(5, clock.millis());
            pstmt.setString(6, id);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Error updating job " + id + " to " + state.dbValue() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Moves a dead job back to pending with a fresh attempt budget.
     *
     * @return false (and no write) when the job does not exist or is not dead
     */
    public boolean resurrect(String id) {
        String sql = "UPDATE jobs SET state = ?, attempts = 0, next_run_at = NULL, last_error = NULL, updated_at = ? "
            + "WHERE id = ? AND state = ?";
        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, JobState.PENDING.dbValue());
            pstmt.setLong(2, clock.millis());
            pstmt.setString(3, id);
            pstmt.setString(4, JobState.DEAD.dbValue());
            return pstmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Error retrying job " + id + ": " + e.getMessage(), e);
        }
    }

    public Job findById(String id) {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE id = ?";
        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? mapRowToJob(rs) : null;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Error reading job " + id + ": " + e.getMessage(), e);
        }
    }

    public List<Job> findByState(JobState state) {
        List<Job> jobs = new ArrayList<>();
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE state = ? ORDER BY created_at ASC, rowid ASC";

        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, state.dbValue());
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRowToJob(rs));
                }
            }
        } catch (SQLException e) {
            throw new JobStoreException("Error getting jobs by state: " + e.getMessage(), e);
        }
        return Collections.unmodifiableList(jobs);
    }

    /**
     * Job count for every state, including zeros.
     */
    public Map<JobState, Integer> countByState() {
        Map<JobState, Integer> counts = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            counts.put(s, 0);
        }
        String sql = "SELECT state, COUNT(*) AS count FROM jobs GROUP BY state";

        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                counts.put(JobState.fromDbValue(rs.getString("state")), rs.getInt("count"));
            }
        } catch (SQLException e) {
            throw new JobStoreException("Error getting job counts: " + e.getMessage(), e);
        }
        return counts;
    }

    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    static boolean isBusy(SQLException e) {
        return hasCode(e, SQLiteErrorCode.SQLITE_BUSY) || hasCode(e, SQLiteErrorCode.SQLITE_LOCKED);
    }

    // sqlite-jdbc reports the primary result code; extended codes share the low byte.
    private static boolean hasCode(SQLException e, SQLiteErrorCode code) {
        return (e.getErrorCode() & 0xff) == code.code;
    }

    private static Instant truncateToMillis(Instant instant) {
        return Instant.ofEpochMilli(instant.toEpochMilli());
    }

    private static Job mapRowToJob(ResultSet rs) throws SQLException {
        long nextRunAt = rs.getLong("next_run_at");
        boolean noNextRun = rs.wasNull();
        return new Job(
            rs.getString("id"),
            rs.getString("command"),
            JobState.fromDbValue(rs.getString("state")),
            rs.getInt("attempts"),
            rs.getInt("retry_limit"),
            Instant.ofEpochMilli(rs.getLong("created_at")),
            Instant.ofEpochMilli(rs.getLong("updated_at")),
            noNextRun ? null : Instant.ofEpochMilli(nextRunAt),
            rs.getString("last_error")
        );
    }
}
