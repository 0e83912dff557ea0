package survey.model.repository;

import survey.model.domain.GlobalTheme;
import survey.model.domain.LanguageLabel;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class ThemesRepo {
    private static final String UPSERT = """
            INSERT INTO themes(theme_name, language, frequency, keywords, created_at, updated_at)
            VALUES(?,?,?,?,?,?)
            ON CONFLICT(theme_name, language) DO UPDATE SET
                frequency = frequency + excluded.frequency,
                updated_at = excluded.updated_at""";

    private final SQLite db;

    public ThemesRepo(SQLite db) { this.db = db; }

    /** Adds {@code count} occurrences to the (name, language) row, creating it when missing. */
    public void increment(Connection con, String name, LanguageLabel language, int count, Instant now) throws SQLException {
        if (count <= 0) throw new IllegalArgumentException("count must be positive: " + count);
        try (var ps = con.prepareStatement(UPSERT)) {
            ps.setString(1, name);
            ps.setString(2, language.name());
            ps.setInt(3, count);
            ps.setString(4, Json.write(List.of(name)));
            ps.setLong(5, now.toEpochMilli());
            ps.setLong(6, now.toEpochMilli());
            ps.executeUpdate();
        }
    }

    /** Highest frequency first; equal frequencies by name. */
    public List<GlobalTheme> top(int limit) {
        return db.read(con -> {
            List<GlobalTheme> out = new ArrayList<>();
            try (var ps = con.prepareStatement(
                    "SELECT * FROM themes ORDER BY frequency DESC, theme_name, language LIMIT ?")) {
                ps.setInt(1, Math.max(1, limit));
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
            return out;
        });
    }

    private static GlobalTheme map(ResultSet rs) throws SQLException {
        return new GlobalTheme(
                rs.getLong("id"),
                rs.getString("theme_name"),
                LanguageLabel.valueOf(rs.getString("language")),
                rs.getInt("frequency"),
                Json.strings(rs.getString("keywords")));
    }
}
