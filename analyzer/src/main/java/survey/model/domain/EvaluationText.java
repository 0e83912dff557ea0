package survey.model.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * One survey row as delivered by ingestion. Ratings are 1..5 and may be missing.
 */
public record EvaluationText(
    Long id,
    String evaluationId,
    String formationId,
    String formationType,
    String trainerId,
    Integer satisfaction,
    Integer content,
    Integer logistics,
    Integer applicability,
    String comment,
    String declaredLanguage,
    Instant date,
    String sourceFile
) {
    public boolean hasComment() { return comment != null && !comment.isBlank(); }

    public Optional<LanguageLabel> declared() { return LanguageLabel.parse(declaredLanguage); }

    public EvaluationText withId(long newId) {
        return new EvaluationText(newId, evaluationId, formationId, formationType, trainerId,
                satisfaction, content, logistics, applicability, comment, declaredLanguage, date, sourceFile);
    }

    /** Comment-only row, mostly for tests and ad-hoc runs. */
    public static EvaluationText ofComment(String evaluationId, String comment) {
        return new EvaluationText(null, evaluationId, null, null, null,
                null, null, null, null, comment, null, Instant.now(), null);
    }
}
