package survey.model.repository;

import survey.model.domain.Analysis;
import survey.model.domain.LanguageLabel;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class AnalysesRepo {
    private static final String UPSERT = """
            INSERT INTO analyses(evaluation_id, language, detected_language, language_confidence,
                sentiment, sentiment_score, sentiment_confidence, sentiment_label, sentiment_strategy,
                themes, cluster_id, embedding, processed_at, model_version)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            ON CONFLICT(evaluation_id) DO UPDATE SET
                language=excluded.language, detected_language=excluded.detected_language,
                language_confidence=excluded.language_confidence, sentiment=excluded.sentiment,
                sentiment_score=excluded.sentiment_score, sentiment_confidence=excluded.sentiment_confidence,
                sentiment_label=excluded.sentiment_label, sentiment_strategy=excluded.sentiment_strategy,
                themes=excluded.themes, cluster_id=excluded.cluster_id, embedding=excluded.embedding,
                processed_at=excluded.processed_at, model_version=excluded.model_version
            RETURNING id""";

    private final SQLite db;

    public AnalysesRepo(SQLite db) { this.db = db; }

    /** Re-analysing an evaluation replaces its previous analysis. */
    public Analysis save(Connection con, Analysis a) throws SQLException {
        try (var ps = con.prepareStatement(UPSERT)) {
            SentimentResult s = a.sentiment();
            ps.setLong(1, a.evaluationId());
            ps.setString(2, a.language().name());
            ps.setString(3, a.detectedLanguage().name());
            ps.setDouble(4, a.languageConfidence());
            ps.setString(5, s.polarity().code());
            ps.setDouble(6, s.score());
            ps.setDouble(7, s.confidence());
            ps.setString(8, s.sourceLabel());
            ps.setString(9, s.strategy());
            ps.setString(10, Json.write(a.themes()));
            Columns.setLong(ps, 11, a.clusterId());
            ps.setString(12, a.embedding() == null ? null : Json.write(a.embedding()));
            Columns.setInstant(ps, 13, a.processedAt());
            ps.setString(14, a.modelVersion());
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) throw new SQLException("no id returned for analysis of evaluation " + a.evaluationId());
                return a.withId(rs.getLong(1));
            }
        }
    }

    public Optional<Analysis> findByEvaluationId(long evaluationId) {
        return db.read(con -> {
            try (var ps = con.prepareStatement("SELECT * FROM analyses WHERE evaluation_id=?")) {
                ps.setLong(1, evaluationId);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Analysis>empty();
                }
            }
        });
    }

    public List<Analysis> findAll() {
        return db.read(con -> {
            List<Analysis> out = new ArrayList<>();
            try (var ps = con.prepareStatement("SELECT * FROM analyses ORDER BY id");
                 var rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        });
    }

    public int count() {
        return db.read(con -> {
            try (var st = con.createStatement(); var rs = st.executeQuery("SELECT COUNT(*) FROM analyses")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static Analysis map(ResultSet rs) throws SQLException {
        var sentiment = new SentimentResult(
                Polarity.fromCode(rs.getString("sentiment")),
                rs.getDouble("sentiment_score"),
                rs.getDouble("sentiment_confidence"),
                rs.getString("sentiment_label"),
                rs.getString("sentiment_strategy"));
        return new Analysis(
                rs.getLong("id"),
                rs.getLong("evaluation_id"),
                LanguageLabel.valueOf(rs.getString("language")),
                LanguageLabel.valueOf(rs.getString("detected_language")),
                rs.getDouble("language_confidence"),
                sentiment,
                Json.strings(rs.getString("themes")),
                Columns.getLong(rs, "cluster_id"),
                Json.floats(rs.getString("embedding")),
                Columns.getInstant(rs, "processed_at"),
                rs.getString("model_version"));
    }
}
