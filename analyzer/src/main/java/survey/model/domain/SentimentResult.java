package survey.model.domain;

/**
 * Polarity of one comment. {@code score} is signed in [-1, 1], {@code confidence} in [0, 1];
 * {@code strategy} tags which link of the fallback chain produced it.
 */
public record SentimentResult(Polarity polarity, double score, double confidence,
                              String sourceLabel, String strategy) {

    public static final String STRATEGY_NONE = "none";
    public static final String STRATEGY_REMOTE = "remote";
    public static final String STRATEGY_RULES = "rule-based";

    public SentimentResult {
        if (score < -1.0 || score > 1.0) throw new IllegalArgumentException("score out of range: " + score);
        if (confidence < 0.0 || confidence > 1.0) throw new IllegalArgumentException("confidence out of range: " + confidence);
    }

    public static SentimentResult emptyText() {
        return new SentimentResult(Polarity.NEUTRAL, 0.0, 0.0, "neutral", STRATEGY_NONE);
    }
}
