package survey.model.repository;

import survey.model.domain.Polarity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Aggregate reads over evaluations and analyses, used by the insight rules. */
public class AnalyticsRepo {
    private final SQLite db;

    public AnalyticsRepo(SQLite db) { this.db = db; }

    public record GroupSatisfaction(String key, double avgSatisfaction, int evaluations) {}

    /** Formation types whose mean satisfaction is strictly below {@code threshold}. */
    public List<GroupSatisfaction> formationsBelow(double threshold) {
        final String sql = """
                SELECT formation_type, AVG(satisfaction) AS avg_sat, COUNT(*) AS c
                FROM evaluations
                WHERE formation_type IS NOT NULL AND satisfaction IS NOT NULL
                GROUP BY formation_type
                HAVING AVG(satisfaction) < ?
                ORDER BY avg_sat, formation_type""";
        return groups(sql, threshold);
    }

    /** Trainers with mean satisfaction of at least {@code minAvg} over at least {@code minCount} evaluations. */
    public List<GroupSatisfaction> trainersAtLeast(double minAvg, int minCount) {
        final String sql = """
                SELECT trainer_id, AVG(satisfaction) AS avg_sat, COUNT(*) AS c
                FROM evaluations
                WHERE trainer_id IS NOT NULL AND satisfaction IS NOT NULL
                GROUP BY trainer_id
                HAVING AVG(satisfaction) >= ? AND COUNT(*) >= ?
                ORDER BY avg_sat DESC, trainer_id""";
        return groups(sql, minAvg, minCount);
    }

    private List<GroupSatisfaction> groups(String sql, Object... params) {
        return db.read(con -> {
            List<GroupSatisfaction> out = new ArrayList<>();
            try (var ps = con.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) ps.setObject(i + 1, params[i]);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) out.add(new GroupSatisfaction(rs.getString(1), rs.getDouble(2), rs.getInt(3)));
                }
            }
            return out;
        });
    }

    /** Polarity counts of analysed evaluations dated within {@code [since, until]}; every polarity is present. */
    public Map<Polarity, Integer> sentimentBetween(Instant since, Instant until) {
        final String sql = """
                SELECT a.sentiment, COUNT(*)
                FROM analyses a JOIN evaluations e ON e.id = a.evaluation_id
                WHERE e.date >= ? AND e.date <= ?
                GROUP BY a.sentiment""";
        return db.read(con -> {
            Map<Polarity, Integer> counts = new EnumMap<>(Polarity.class);
            for (Polarity p : Polarity.values()) counts.put(p, 0);
            try (var ps = con.prepareStatement(sql)) {
                ps.setLong(1, since.toEpochMilli());
                ps.setLong(2, until.toEpochMilli());
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) counts.put(Polarity.fromCode(rs.getString(1)), rs.getInt(2));
                }
            }
            return counts;
        });
    }
}
