package survey.model.domain;

public enum InsightKind {
    LOW_SIGNAL, TREND, RECOMMENDATION, ANOMALY
}
