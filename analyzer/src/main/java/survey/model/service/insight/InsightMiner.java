package survey.model.service.insight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.Insight;
import survey.model.domain.InsightKind;
import survey.model.domain.Polarity;
import survey.model.repository.AnalyticsRepo;
import survey.model.repository.InsightsRepo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Rule-based insights over the stored evaluations and analyses. Every run writes what it finds;
 * running twice on unchanged data stores the same insights twice.
 */
public class InsightMiner {
    private static final Logger log = LoggerFactory.getLogger(InsightMiner.class);

    static final double LOW_SATISFACTION = 3.0;
    static final double EXCELLENT_SATISFACTION = 4.5;
    static final int EXCELLENT_MIN_EVALUATIONS = 5;
    static final int RECENT_DAYS = 7;
    static final double NEGATIVE_SHARE_PERCENT = 30.0;

    private final AnalyticsRepo analytics;
    private final InsightsRepo insights;
    private final Clock clock;

    public InsightMiner(AnalyticsRepo analytics, InsightsRepo insights, Clock clock) {
        this.analytics = Objects.requireNonNull(analytics, "analyticsRepo");
        this.insights = Objects.requireNonNull(insights, "insightsRepo");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Evaluates all rules and stores the results atomically. */
    public List<Insight> generate() {
        Instant now = clock.instant();
        List<Insight> found = new ArrayList<>();
        found.addAll(lowSatisfaction(now));
        found.addAll(trainerExcellence(now));
        found.addAll(negativeSentiment(now));

        List<Insight> saved = insights.saveAll(found);
        log.info("generated {} insights", saved.size());
        return saved;
    }

    public List<Insight> recent(int limit) {
        return insights.recent(limit);
    }

    private List<Insight> lowSatisfaction(Instant now) {
        List<Insight> out = new ArrayList<>();
        for (var g : analytics.formationsBelow(LOW_SATISFACTION)) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("formation", g.key());
            data.put("avg_satisfaction", g.avgSatisfaction());
            data.put("evaluations", g.evaluations());
            out.add(new Insight(null, InsightKind.LOW_SIGNAL,
                    InsightTemplates.LOW_SATISFACTION_TITLE.formatted(g.key()),
                    String.format(Locale.ROOT, InsightTemplates.LOW_SATISFACTION_TEXT,
                            g.key(), g.avgSatisfaction(), g.evaluations(), LOW_SATISFACTION),
                    data, 0.9, g.key(), null, null, null, now));
        }
        return out;
    }

    private List<Insight> trainerExcellence(Instant now) {
        List<Insight> out = new ArrayList<>();
        for (var g : analytics.trainersAtLeast(EXCELLENT_SATISFACTION, EXCELLENT_MIN_EVALUATIONS)) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("trainer", g.key());
            data.put("avg_satisfaction", g.avgSatisfaction());
            data.put("evaluations", g.evaluations());
            out.add(new Insight(null, InsightKind.TREND,
                    InsightTemplates.TRAINER_EXCELLENCE_TITLE.formatted(g.key()),
                    String.format(Locale.ROOT, InsightTemplates.TRAINER_EXCELLENCE_TEXT,
                            g.key(), g.avgSatisfaction(), g.evaluations()),
                    data, 0.95, null, g.key(), null, null, now));
        }
        return out;
    }

    private List<Insight> negativeSentiment(Instant now) {
        Instant since = now.minus(Duration.ofDays(RECENT_DAYS));
        Map<Polarity, Integer> counts = analytics.sentimentBetween(since, now);
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) return List.of();

        double negativePct = counts.get(Polarity.NEGATIVE) * 100.0 / total;
        if (negativePct <= NEGATIVE_SHARE_PERCENT) return List.of();

        Map<String, Integer> distribution = new LinkedHashMap<>();
        counts.forEach((p, c) -> distribution.put(p.code(), c));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sentiment_distribution", distribution);
        data.put("negative_percentage", negativePct);
        return List.of(new Insight(null, InsightKind.TREND,
                InsightTemplates.NEGATIVE_INCREASE_TITLE,
                String.format(Locale.ROOT, InsightTemplates.NEGATIVE_INCREASE_TEXT, negativePct, RECENT_DAYS),
                data, 0.8, null, null, since, now, now));
    }
}
