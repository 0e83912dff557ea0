package survey.model.repository;

import survey.model.domain.EvaluationText;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class EvaluationsRepo {
    private static final String UPSERT = """
            INSERT INTO evaluations(evaluation_id, formation_id, formation_type, trainer_id,
                satisfaction, content, logistics, applicability, comment, declared_language,
                date, source_file, created_at)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
            ON CONFLICT(evaluation_id) DO UPDATE SET
                formation_id=excluded.formation_id, formation_type=excluded.formation_type,
                trainer_id=excluded.trainer_id, satisfaction=excluded.satisfaction,
                content=excluded.content, logistics=excluded.logistics,
                applicability=excluded.applicability, comment=excluded.comment,
                declared_language=excluded.declared_language, date=excluded.date,
                source_file=excluded.source_file
            RETURNING id""";

    private final SQLite db;

    public EvaluationsRepo(SQLite db) { this.db = db; }

    /** Stores the rows in one transaction; a row with a known {@code evaluationId} is updated in place. */
    public List<EvaluationText> saveAll(List<EvaluationText> rows) {
        return db.inTransaction(con -> {
            List<EvaluationText> out = new ArrayList<>(rows.size());
            for (var r : rows) out.add(save(con, r));
            return out;
        });
    }

    public EvaluationText save(EvaluationText e) {
        return db.inTransaction(con -> save(con, e));
    }

    public EvaluationText save(Connection con, EvaluationText e) throws SQLException {
        try (var ps = con.prepareStatement(UPSERT)) {
            ps.setString(1, e.evaluationId());
            ps.setString(2, e.formationId());
            ps.setString(3, e.formationType());
            ps.setString(4, e.trainerId());
            Columns.setInt(ps, 5, e.satisfaction());
            Columns.setInt(ps, 6, e.content());
            Columns.setInt(ps, 7, e.logistics());
            Columns.setInt(ps, 8, e.applicability());
            ps.setString(9, e.comment());
            ps.setString(10, e.declaredLanguage());
            Columns.setInstant(ps, 11, e.date());
            ps.setString(12, e.sourceFile());
            ps.setLong(13, Instant.now().toEpochMilli());
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) throw new SQLException("no id returned for evaluation " + e.evaluationId());
                return e.withId(rs.getLong(1));
            }
        }
    }

    public Optional<EvaluationText> findById(long id) {
        return db.read(con -> {
            try (var ps = con.prepareStatement("SELECT * FROM evaluations WHERE id=?")) {
                ps.setLong(1, id);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<EvaluationText>empty();
                }
            }
        });
    }

    public List<EvaluationText> findAll() {
        return db.read(con -> {
            List<EvaluationText> out = new ArrayList<>();
            try (var ps = con.prepareStatement("SELECT * FROM evaluations ORDER BY id");
                 var rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        });
    }

    public int count() {
        return db.read(con -> {
            try (var st = con.createStatement(); var rs = st.executeQuery("SELECT COUNT(*) FROM evaluations")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static EvaluationText map(ResultSet rs) throws SQLException {
        return new EvaluationText(
                rs.getLong("id"),
                rs.getString("evaluation_id"),
                rs.getString("formation_id"),
                rs.getString("formation_type"),
                rs.getString("trainer_id"),
                Columns.getInt(rs, "satisfaction"),
                Columns.getInt(rs, "content"),
                Columns.getInt(rs, "logistics"),
                Columns.getInt(rs, "applicability"),
                rs.getString("comment"),
                rs.getString("declared_language"),
                Columns.getInstant(rs, "date"),
                rs.getString("source_file"));
    }
}
