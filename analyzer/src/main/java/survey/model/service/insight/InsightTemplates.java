package survey.model.service.insight;

/** Title and description formats of the generated insights. */
final class InsightTemplates {
    private InsightTemplates() {}

    static final String LOW_SATISFACTION_TITLE = "Low satisfaction: %s";
    static final String LOW_SATISFACTION_TEXT =
            "Formation '%s' has a mean satisfaction of %.2f/5 over %d evaluations, below the acceptable threshold of %.1f.";

    static final String TRAINER_EXCELLENCE_TITLE = "Trainer excellence: %s";
    static final String TRAINER_EXCELLENCE_TEXT =
            "Trainer %s reaches a mean satisfaction of %.2f/5 over %d evaluations.";

    static final String NEGATIVE_INCREASE_TITLE = "Negative sentiment increase";
    static final String NEGATIVE_INCREASE_TEXT =
            "%.1f%% of the evaluations from the last %d days express a negative sentiment.";
}
