package survey.model.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Arrays;

public class SQLite {
    private static final Logger log = LoggerFactory.getLogger(SQLite.class);
    private static final String SCHEMA = "/sql/schema.sql";

    private final Path dbPath;

    public SQLite(String dbPath) {
        this.dbPath = Path.of(dbPath);
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection con) throws SQLException;
    }

    /** Opens a fresh connection with foreign keys enforced. Callers close it. */
    public Connection connect() {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Connection con = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var st = con.createStatement()) {
                st.execute("PRAGMA foreign_keys = ON");
            }
            return con;
        } catch (SQLException | IOException e) {
            throw new PersistenceException("cannot open " + dbPath, e);
        }
    }

    public <T> T read(SqlWork<T> work) {
        try (Connection con = connect()) {
            return work.run(con);
        } catch (SQLException e) {
            throw new PersistenceException("query failed: " + e.getMessage(), e);
        }
    }

    /** Runs {@code work} in one transaction: everything commits or nothing does. */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection con = connect()) {
            con.setAutoCommit(false);
            try {
                T result = work.run(con);
                con.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(con, e);
                if (e instanceof PersistenceException pe) throw pe;
                throw new PersistenceException("transaction rolled back: " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new PersistenceException("transaction failed: " + e.getMessage(), e);
        }
    }

    private static void rollbackQuietly(Connection con, Exception cause) {
        try {
            con.rollback();
        } catch (SQLException re) {
            cause.addSuppressed(re);
        }
    }

    public void migrate() {
        String sql;
        try (var in = SQLite.class.getResourceAsStream(SCHEMA)) {
            if (in == null) throw new PersistenceException("schema not found at " + SCHEMA);
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("cannot read " + SCHEMA, e);
        }
        inTransaction(con -> {
            try (var st = con.createStatement()) {
                for (String stmt : statements(sql)) st.executeUpdate(stmt);
            }
            return null;
        });
        log.debug("schema applied to {}", dbPath.toAbsolutePath());
    }

    static String[] statements(String script) {
        String withoutComments = script.replaceAll("(?m)^\\s*--.*$", "");
        return Arrays.stream(withoutComments.split(";"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    public Path path() { return dbPath; }
}
