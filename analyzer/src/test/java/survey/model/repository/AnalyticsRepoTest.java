package survey.model.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import survey.model.domain.Analysis;
import survey.model.domain.EvaluationText;
import survey.model.domain.LanguageLabel;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnalyticsRepoTest {

    @TempDir
    Path tmp;

    private SQLite db;
    private EvaluationsRepo evaluations;
    private AnalyticsRepo analytics;
    private int seq;

    @BeforeEach
    void setUp() {
        db = new SQLite(tmp.resolve("analytics.db").toString());
        db.migrate();
        evaluations = new EvaluationsRepo(db);
        analytics = new AnalyticsRepo(db);
    }

    private EvaluationText evaluation(String type, String trainer, Integer satisfaction, Instant date) {
        return evaluations.save(new EvaluationText(null, "E-" + (++seq), "F", type, trainer, satisfaction,
                null, null, null, "commentaire", null, date, null));
    }

    private void analysed(EvaluationText e, Polarity p) {
        double score = p == Polarity.POSITIVE ? 0.8 : p == Polarity.NEGATIVE ? -0.8 : 0.0;
        db.inTransaction(con -> new AnalysesRepo(db).save(con, new Analysis(null, e.id(), LanguageLabel.FR,
                LanguageLabel.FR, 1.0, new SentimentResult(p, score, 0.8, p.code(), SentimentResult.STRATEGY_RULES),
                List.of(), null, null, Instant.EPOCH, Analysis.MODEL_VERSION)));
    }

    @Test
    void formationsBelow_shouldReturnTypesUnderThresholdOnly() {
        Instant d = Instant.parse("2024-01-01T00:00:00Z");
        evaluation("Excel", null, 2, d);
        evaluation("Excel", null, 3, d);
        evaluation("Java", null, 3, d);
        evaluation("Java", null, 3, d);
        evaluation("Python", null, null, d);

        List<AnalyticsRepo.GroupSatisfaction> low = analytics.formationsBelow(3.0);

        assertThat(low).hasSize(1);
        assertThat(low.get(0).key()).isEqualTo("Excel");
        assertThat(low.get(0).avgSatisfaction()).isCloseTo(2.5, within(1e-9));
        assertThat(low.get(0).evaluations()).isEqualTo(2);
    }

    @Test
    void trainersAtLeast_shouldRequireBothAverageAndVolume() {
        Instant d = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) evaluation("Java", "T-1", i == 0 ? 4 : 5, d);
        for (int i = 0; i < 4; i++) evaluation("Java", "T-2", 5, d);

        List<AnalyticsRepo.GroupSatisfaction> top = analytics.trainersAtLeast(4.5, 5);

        assertThat(top).extracting(AnalyticsRepo.GroupSatisfaction::key).containsExactly("T-1");
        assertThat(top.get(0).avgSatisfaction()).isCloseTo(4.8, within(1e-9));
    }

    @Test
    void sentimentBetween_shouldCountOnlyAnalysedEvaluationsInsideTheWindow() {
        Instant since = Instant.parse("2024-03-01T00:00:00Z");
        Instant until = since.plusSeconds(3600);
        analysed(evaluation("Java", null, 4, since.plusSeconds(10)), Polarity.NEGATIVE);
        analysed(evaluation("Java", null, 4, since.plusSeconds(20)), Polarity.POSITIVE);
        analysed(evaluation("Java", null, 4, since.minusSeconds(10)), Polarity.NEGATIVE);
        analysed(evaluation("Java", null, 4, until.plusSeconds(1)), Polarity.NEGATIVE);
        analysed(evaluation("Java", null, 4, until), Polarity.NEUTRAL);
        evaluation("Java", null, 4, since.plusSeconds(30));

        Map<Polarity, Integer> counts = analytics.sentimentBetween(since, until);

        assertThat(counts).containsEntry(Polarity.NEGATIVE, 1)
                .containsEntry(Polarity.POSITIVE, 1)
                .containsEntry(Polarity.NEUTRAL, 1);
    }
}
