package survey.model.repository;

import survey.model.domain.PersistedCluster;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

public class ClustersRepo {
    private final SQLite db;

    public ClustersRepo(SQLite db) { this.db = db; }

    public PersistedCluster insert(Connection con, PersistedCluster c) throws SQLException {
        String sql = "INSERT INTO clusters(cluster_label, cluster_number, size, representative_themes, "
                + "avg_sentiment, centroid, created_at) VALUES(?,?,?,?,?,?,?)";
        try (var ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, c.label());
            ps.setInt(2, c.number());
            ps.setInt(3, c.size());
            ps.setString(4, Json.write(c.representativeThemes()));
            ps.setDouble(5, c.avgSentiment());
            ps.setString(6, Json.write(c.centroid()));
            Columns.setInstant(ps, 7, c.createdAt());
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no id generated for " + c.label());
                return c.withId(keys.getLong(1));
            }
        }
    }

    /** Latest run first, then by cluster number. */
    public List<PersistedCluster> findAll() {
        return db.read(con -> {
            List<PersistedCluster> out = new ArrayList<>();
            try (var ps = con.prepareStatement("SELECT * FROM clusters ORDER BY created_at DESC, cluster_number, id");
                 var rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        });
    }

    private static PersistedCluster map(ResultSet rs) throws SQLException {
        return new PersistedCluster(
                rs.getLong("id"),
                rs.getString("cluster_label"),
                rs.getInt("cluster_number"),
                rs.getInt("size"),
                Json.strings(rs.getString("representative_themes")),
                rs.getDouble("avg_sentiment"),
                Json.floats(rs.getString("centroid")),
                Columns.getInstant(rs, "created_at"));
    }
}
