package survey.model.domain;

import java.time.Instant;
import java.util.Map;

public record Insight(
    Long id,
    InsightKind kind,
    String title,
    String description,
    Map<String, Object> data,
    double confidence,
    String formationType,
    String trainerId,
    Instant rangeStart,
    Instant rangeEnd,
    Instant createdAt
) {
    public Insight withId(long newId) {
        return new Insight(newId, kind, title, description, data, confidence,
                formationType, trainerId, rangeStart, rangeEnd, createdAt);
    }
}
