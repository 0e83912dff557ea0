package survey.model.domain;

import java.time.Instant;
import java.util.List;

public record PersistedCluster(
    Long id,
    String label,
    int number,
    int size,
    List<String> representativeThemes,
    double avgSentiment,
    float[] centroid,
    Instant createdAt
) {
    public PersistedCluster withId(long newId) {
        return new PersistedCluster(newId, label, number, size, representativeThemes, avgSentiment, centroid, createdAt);
    }
}
