package com.sysmuse.hash.store;

import java.io.IOException;
import java.nio.file.*;
import java.sql.*;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import com.sysmuse.hash.InternCache;
import com.sysmuse.hash.LoggingUtil;
import com.sysmuse.hash.MappingRecord;
import com.sysmuse.hash.StoreException;

/**
 * Mapping store backed by an embedded H2 database in a private scratch directory.
 * <p>
 * The database lives only as long as the store: {@link #close()} shuts it down and
 * deletes the directory. Rows streamed out are passed through a fresh
 * {@link InternCache} per query, so repeated field names and digests share one instance.
 * <p>
 * Strings compare with H2's default collation, which orders like {@link String#compareTo},
 * so the ordering matches {@link InMemoryMappingStore}.
 */
public class H2MappingStore implements MappingStore {

    static final String TABLE = "hash_mapping";

    private static final int BATCH_SIZE = 1000;
    private static final int FETCH_SIZE = 1000;

    private static final String CREATE_TABLE =
            "CREATE TABLE " + TABLE + " (" +
                    "seq BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                    "digest VARCHAR NOT NULL, " +
                    "plaintext VARCHAR NOT NULL, " +
                    "field VARCHAR NOT NULL)";

    private static final String INSERT =
            "INSERT INTO " + TABLE + " (digest, plaintext, field) VALUES (?, ?, ?)";

    private static final String BY_FIELD_THEN_PLAINTEXT =
            "SELECT digest, plaintext, field FROM " + TABLE + " ORDER BY field, plaintext, digest";

    private static final String BY_DIGEST_FOR_FIELD =
            "SELECT digest, plaintext, field FROM " + TABLE + " WHERE field = ? ORDER BY digest, plaintext";

    private static final String PROJECTION =
            "SELECT plaintext, digest FROM " + TABLE + " ORDER BY seq";

    private static final String PROJECTION_FOR_FIELD =
            "SELECT plaintext, digest FROM " + TABLE + " WHERE field = ? ORDER BY seq";

    private final Path directory;
    private final Connection connection;
    private final PreparedStatement insert;
    private int pendingBatch = 0;
    private long size = 0;
    private boolean closed = false;

    /**
     * Create a new, empty store
     *
     * @param scratchParent directory under which the private database directory is created
     * @throws StoreException if the directory or database cannot be created
     */
    public H2MappingStore(Path scratchParent) {
        Path dir = null;
        Connection con = null;
        try {
            Files.createDirectories(scratchParent);
            dir = Files.createTempDirectory(scratchParent, "csvhash-store-");
            String url = "jdbc:h2:" + dir.resolve("mapping").toAbsolutePath();
            con = DriverManager.getConnection(url);
            try (Statement stmt = con.createStatement()) {
                stmt.execute(CREATE_TABLE);
            }
            con.setAutoCommit(false);
            this.insert = con.prepareStatement(INSERT);
        } catch (IOException | SQLException e) {
            closeQuietly(con);
            deleteDirectory(dir);
            throw new StoreException("Could not create scratch mapping database under " + scratchParent, e);
        }
        this.directory = dir;
        this.connection = con;
        LoggingUtil.debug("Created scratch mapping database in " + directory);
    }

    /**
     * Scratch directory holding the database files
     */
    public Path getDirectory() {
        return directory;
    }

    @Override
    public void append(MappingRecord record) {
        ensureOpen();
        try {
            insert.setString(1, record.getDigest());
            insert.setString(2, record.getPlaintext());
            insert.setString(3, record.getField());
            insert.addBatch();
            size++;
            if (++pendingBatch >= BATCH_SIZE) {
                executeBatch();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to append to mapping database", e);
        }
    }

    @Override
    public void flush() {
        ensureOpen();
        try {
            if (pendingBatch > 0) {
                executeBatch();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to flush mapping database", e);
        }
    }

    private void executeBatch() throws SQLException {
        insert.executeBatch();
        connection.commit();
        LoggingUtil.debug("Committed " + pendingBatch + " mapping rows (" + size + " total)");
        pendingBatch = 0;
    }

    @Override
    public long size() {
        ensureOpen();
        return size;
    }

    @Override
    public RecordCursor streamOrderedByFieldThenPlaintext() {
        return query(BY_FIELD_THEN_PLAINTEXT, null);
    }

    @Override
    public RecordCursor streamOrderedByDigestForField(String field) {
        return query(BY_DIGEST_FOR_FIELD, field);
    }

    @Override
    public Map<String, String> projectPlaintextToDigest() {
        return project(PROJECTION, null);
    }

    @Override
    public Map<String, String> projectPlaintextToDigest(String field) {
        return project(PROJECTION_FOR_FIELD, field);
    }

    private Map<String, String> project(String sql, String field) {
        flush();
        InternCache cache = new InternCache();
        Map<String, String> projection = new HashMap<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            if (field != null) {
                stmt.setString(1, field);
            }
            stmt.setFetchSize(FETCH_SIZE);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    projection.put(cache.intern(rs.getString(1)), cache.intern(rs.getString(2)));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to project plaintext to digest mapping", e);
        }
        return projection;
    }

    private RecordCursor query(String sql, String field) {
        flush();
        PreparedStatement stmt = null;
        try {
            stmt = connection.prepareStatement(sql);
            if (field != null) {
                stmt.setString(1, field);
            }
            stmt.setFetchSize(FETCH_SIZE);
            return new ResultSetCursor(stmt, stmt.executeQuery());
        } catch (SQLException e) {
            closeQuietly(stmt);
            throw new StoreException("Failed to query mapping database", e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            insert.close();
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("SHUTDOWN");
            }
        } catch (SQLException e) {
            LoggingUtil.warn("Error shutting down scratch mapping database: " + e.getMessage());
        } finally {
            closeQuietly(connection);
            deleteDirectory(directory);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException("Mapping database is closed");
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            LoggingUtil.debug("Ignoring error on close: " + e.getMessage());
        }
    }

    private static void deleteDirectory(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LoggingUtil.warn("Failed to delete scratch file: " + path + " - " + e.getMessage());
                }
            });
            LoggingUtil.debug("Removed scratch mapping database " + dir);
        } catch (IOException e) {
            LoggingUtil.warn("Failed to remove scratch directory: " + dir + " - " + e.getMessage());
        }
    }

    /**
     * Lookahead cursor over an open result set. Owns the statement.
     */
    private static class ResultSetCursor implements RecordCursor {
        private final PreparedStatement stmt;
        private final ResultSet rs;
        private final InternCache cache = new InternCache();
        private MappingRecord next;
        private boolean done = false;

        ResultSetCursor(PreparedStatement stmt, ResultSet rs) {
            this.stmt = stmt;
            this.rs = rs;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            try {
                if (rs.next()) {
                    next = new MappingRecord(
                            cache.intern(rs.getString(1)),
                            cache.intern(rs.getString(2)),
                            cache.intern(rs.getString(3)));
                    return true;
                }
            } catch (SQLException e) {
                close();
                throw new StoreException("Failed to read from mapping database", e);
            }
            close();
            return false;
        }

        @Override
        public MappingRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            MappingRecord record = next;
            next = null;
            return record;
        }

        @Override
        public void close() {
            if (done) {
                return;
            }
            done = true;
            cache.clear();
            closeQuietly(rs);
            closeQuietly(stmt);
        }
    }
}
