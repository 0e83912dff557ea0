package survey.model.repository;

import survey.model.domain.Insight;
import survey.model.domain.InsightKind;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

public class InsightsRepo {
    private final SQLite db;

    public InsightsRepo(SQLite db) { this.db = db; }

    /** Writes all insights in one transaction and returns them with their ids. */
    public List<Insight> saveAll(List<Insight> insights) {
        return db.inTransaction(con -> {
            List<Insight> out = new ArrayList<>(insights.size());
            for (var i : insights) out.add(insert(con, i));
            return out;
        });
    }

    Insight insert(Connection con, Insight i) throws SQLException {
        String sql = "INSERT INTO insights(insight_type, title, description, data, confidence, formation_type, "
                + "trainer_id, range_start, range_end, created_at) VALUES(?,?,?,?,?,?,?,?,?,?)";
        try (var ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, i.kind().name());
            ps.setString(2, i.title());
            ps.setString(3, i.description());
            ps.setString(4, Json.write(i.data()));
            ps.setDouble(5, i.confidence());
            ps.setString(6, i.formationType());
            ps.setString(7, i.trainerId());
            Columns.setInstant(ps, 8, i.rangeStart());
            Columns.setInstant(ps, 9, i.rangeEnd());
            Columns.setInstant(ps, 10, i.createdAt());
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no id generated for insight " + i.title());
                return i.withId(keys.getLong(1));
            }
        }
    }

    public List<Insight> recent(int limit) {
        return db.read(con -> {
            List<Insight> out = new ArrayList<>();
            try (var ps = con.prepareStatement("SELECT * FROM insights ORDER BY created_at DESC, id DESC LIMIT ?")) {
                ps.setInt(1, Math.max(1, limit));
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
            return out;
        });
    }

    public int count() {
        return db.read(con -> {
            try (var st = con.createStatement(); var rs = st.executeQuery("SELECT COUNT(*) FROM insights")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static Insight map(ResultSet rs) throws SQLException {
        return new Insight(
                rs.getLong("id"),
                InsightKind.valueOf(rs.getString("insight_type")),
                rs.getString("title"),
                rs.getString("description"),
                Json.object(rs.getString("data")),
                rs.getDouble("confidence"),
                rs.getString("formation_type"),
                rs.getString("trainer_id"),
                Columns.getInstant(rs, "range_start"),
                Columns.getInstant(rs, "range_end"),
                Columns.getInstant(rs, "created_at"));
    }
}
