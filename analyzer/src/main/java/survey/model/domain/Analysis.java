package survey.model.domain;

import java.time.Instant;
import java.util.List;

public record Analysis(
    Long id,
    long evaluationId,
    LanguageLabel language,
    LanguageLabel detectedLanguage,
    double languageConfidence,
    SentimentResult sentiment,
    List<String> themes,
    Long clusterId,
    float[] embedding,
    Instant processedAt,
    String modelVersion
) {
    public static final String MODEL_VERSION = "1.0";

    public Analysis withId(long newId) {
        return new Analysis(newId, evaluationId, language, detectedLanguage, languageConfidence,
                sentiment, themes, clusterId, embedding, processedAt, modelVersion);
    }
}
