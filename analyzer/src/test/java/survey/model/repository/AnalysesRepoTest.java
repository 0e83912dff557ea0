package survey.model.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import survey.model.domain.Analysis;
import survey.model.domain.EvaluationText;
import survey.model.domain.Insight;
import survey.model.domain.InsightKind;
import survey.model.domain.LanguageLabel;
import survey.model.domain.PersistedCluster;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysesRepoTest {

    @TempDir
    Path tmp;

    private SQLite db;
    private AnalysesRepo analyses;
    private ClustersRepo clusters;
    private long evaluationId;
    private final Instant now = Instant.parse("2024-06-01T08:00:00Z");

    @BeforeEach
    void setUp() {
        db = new SQLite(tmp.resolve("analyses.db").toString());
        db.migrate();
        analyses = new AnalysesRepo(db);
        clusters = new ClustersRepo(db);
        evaluationId = new EvaluationsRepo(db).save(EvaluationText.ofComment("E-1", "Salle trop petite")).id();
    }

    private Analysis analysis(Polarity polarity, double score, Long clusterId, float[] embedding) {
        return new Analysis(null, evaluationId, LanguageLabel.FR, LanguageLabel.FR, 0.9,
                new SentimentResult(polarity, score, Math.abs(score), "m:" + polarity, SentimentResult.STRATEGY_REMOTE),
                List.of("salle", "salle petite"), clusterId, embedding, now, Analysis.MODEL_VERSION);
    }

    @Test
    void save_shouldRoundTripAnalysisWithCluster() {
        PersistedCluster cluster = db.inTransaction(con -> clusters.insert(con,
                new PersistedCluster(null, "Cluster 0", 0, 1, List.of("salle"), -0.7, new float[]{0.5f, 1.5f}, now)));

        Analysis saved = db.inTransaction(con -> analyses.save(con,
                analysis(Polarity.NEGATIVE, -0.7, cluster.id(), new float[]{0.5f, 1.5f})));

        Analysis back = analyses.findByEvaluationId(evaluationId).orElseThrow();
        assertThat(back.id()).isEqualTo(saved.id());
        assertThat(back.sentiment().polarity()).isEqualTo(Polarity.NEGATIVE);
        assertThat(back.sentiment().strategy()).isEqualTo(SentimentResult.STRATEGY_REMOTE);
        assertThat(back.themes()).containsExactly("salle", "salle petite");
        assertThat(back.clusterId()).isEqualTo(cluster.id());
        assertThat(back.embedding()).containsExactly(0.5f, 1.5f);
        assertThat(back.processedAt()).isEqualTo(now);

        PersistedCluster storedCluster = clusters.findAll().get(0);
        assertThat(storedCluster.representativeThemes()).containsExactly("salle");
        assertThat(storedCluster.centroid()).containsExactly(0.5f, 1.5f);
    }

    @Test
    void save_shouldReplacePreviousAnalysisOfSameEvaluation() {
        db.inTransaction(con -> analyses.save(con, analysis(Polarity.POSITIVE, 0.8, null, null)));
        db.inTransaction(con -> analyses.save(con, analysis(Polarity.NEGATIVE, -0.6, null, null)));

        assertThat(analyses.count()).isEqualTo(1);
        Analysis back = analyses.findAll().get(0);
        assertThat(back.sentiment().polarity()).isEqualTo(Polarity.NEGATIVE);
        assertThat(back.clusterId()).isNull();
        assertThat(back.embedding()).isNull();
    }

    @Test
    void insights_shouldKeepDataAndComeBackNewestFirst() {
        InsightsRepo insights = new InsightsRepo(db);
        insights.saveAll(List.of(
                new Insight(null, InsightKind.LOW_SIGNAL, "old", "d", Map.of("formation", "Java"), 0.9,
                        "Java", null, null, null, now.minusSeconds(60)),
                new Insight(null, InsightKind.TREND, "new", "d", Map.of("negative_percentage", 40.0), 0.8,
                        null, null, now.minusSeconds(3600), now, now)));

        List<Insight> recent = insights.recent(10);
        assertThat(recent).extracting(Insight::title).containsExactly("new", "old");
        assertThat(recent.get(0).data()).containsEntry("negative_percentage", 40.0);
        assertThat(recent.get(0).rangeStart()).isEqualTo(now.minusSeconds(3600));
        assertThat(recent.get(1).formationType()).isEqualTo("Java");
        assertThat(insights.recent(1)).hasSize(1);
    }
}
