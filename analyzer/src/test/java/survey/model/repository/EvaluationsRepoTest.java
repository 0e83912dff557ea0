package survey.model.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import survey.model.domain.EvaluationText;
import survey.model.domain.LanguageLabel;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationsRepoTest {

    @TempDir
    Path tmp;

    private EvaluationsRepo repo;

    @BeforeEach
    void setUp() {
        SQLite db = new SQLite(tmp.resolve("eval.db").toString());
        db.migrate();
        repo = new EvaluationsRepo(db);
    }

    private static EvaluationText row(String evaluationId, Integer satisfaction, String comment) {
        return new EvaluationText(null, evaluationId, "F-01", "Java", "T-7", satisfaction, 4, null, 5,
                comment, "fr", Instant.parse("2024-02-10T09:30:00Z"), "batch.jsonl");
    }

    @Test
    void save_shouldAssignIdAndRoundTripNullableColumns() {
        EvaluationText saved = repo.save(row("E-1", 3, "Formation claire"));

        EvaluationText back = repo.findById(saved.id()).orElseThrow();
        assertThat(back).isEqualTo(saved);
        assertThat(back.logistics()).isNull();
        assertThat(back.declared()).contains(LanguageLabel.FR);
    }

    @Test
    void save_shouldUpdateRowWithKnownEvaluationId() {
        EvaluationText first = repo.save(row("E-1", 3, "avant"));
        EvaluationText second = repo.save(row("E-1", 5, "après"));

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(repo.count()).isEqualTo(1);
        assertThat(repo.findById(first.id()).orElseThrow().comment()).isEqualTo("après");
    }

    @Test
    void saveAll_shouldStoreRowsWithoutEvaluationIdSeparately() {
        List<EvaluationText> saved = repo.saveAll(List.of(
                EvaluationText.ofComment(null, "un"), EvaluationText.ofComment(null, "deux")));

        assertThat(saved).extracting(EvaluationText::id).doesNotContainNull().doesNotHaveDuplicates();
        assertThat(repo.findAll()).extracting(EvaluationText::comment).containsExactly("un", "deux");
    }

    @Test
    void findById_shouldBeEmptyForUnknownId() {
        assertThat(repo.findById(42)).isEmpty();
    }
}
