package survey.model.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.Analysis;
import survey.model.domain.EvaluationText;
import survey.model.domain.LanguageLabel;
import survey.model.domain.PersistedCluster;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;
import survey.model.repository.AnalysesRepo;
import survey.model.repository.AnalyticsRepo;
import survey.model.repository.ClustersRepo;
import survey.model.repository.EvaluationsRepo;
import survey.model.repository.InsightsRepo;
import survey.model.repository.SQLite;
import survey.model.repository.ThemesRepo;
import survey.model.service.cluster.ClusteringResult;
import survey.model.service.cluster.EmbeddingClusterer;
import survey.model.service.cluster.HuggingFaceEmbeddingModel;
import survey.model.service.config.AppConfig;
import survey.model.service.insight.InsightMiner;
import survey.model.service.nlp.LanguageClassifier;
import survey.model.service.nlp.LinguaLanguageIdentifier;
import survey.model.service.nlp.RemoteSentimentModel;
import survey.model.service.nlp.SentimentScorer;
import survey.model.service.theme.ThemeCategorizer;
import survey.model.service.theme.ThemeExtractor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch analysis:
 *  1) skip blank comments
 *  2) language (declared wins, detected is kept), sentiment and themes per item on the worker pool
 *  3) embedding + clustering over the whole batch
 *  4) one transaction: clusters, analyses, theme counts
 */
public class AnalysisPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    /* ---------- Factory ---------- */

    /** Builds every heavy collaborator once; the returned pipeline owns its worker pool. */
    public static AnalysisPipeline createDefault(AppConfig cfg) {
        log.info("database: {}", cfg.dbPath);
        SQLite db = new SQLite(cfg.dbPath);
        db.migrate();

        var classifier = new LanguageClassifier(new LinguaLanguageIdentifier(cfg.language.candidates()));
        var scorer = SentimentScorer.remoteThenRules(new RemoteSentimentModel(cfg.sentiment));
        var extractor = new ThemeExtractor(cfg.pipeline.topThemes());
        var clusterer = new EmbeddingClusterer(new HuggingFaceEmbeddingModel(cfg.embedding), cfg.clustering);

        return new AnalysisPipeline(db, classifier, scorer, extractor, clusterer,
                cfg.clustering.method(), cfg.pipeline.workers(), Clock.systemUTC());
    }

    /* ---------- Fields ---------- */

    private final SQLite db;
    private final LanguageClassifier classifier;
    private final SentimentScorer scorer;
    private final ThemeExtractor extractor;
    private final EmbeddingClusterer clusterer;
    private final String clusterMethod;
    private final Clock clock;
    private final ExecutorService workers;

    private final EvaluationsRepo evaluationsRepo;
    private final AnalysesRepo analysesRepo;
    private final ClustersRepo clustersRepo;
    private final ThemesRepo themesRepo;
    private final ThemeCategorizer categorizer;
    private final InsightMiner insightMiner;

    private volatile BatchSummary lastSummary;

    public AnalysisPipeline(SQLite db,
                            LanguageClassifier classifier,
                            SentimentScorer scorer,
                            ThemeExtractor extractor,
                            EmbeddingClusterer clusterer,
                            String clusterMethod,
                            int workerCount,
                            Clock clock) {
        this.db = Objects.requireNonNull(db, "db");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clusterer = Objects.requireNonNull(clusterer, "clusterer");
        this.clusterMethod = clusterMethod;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), workerThreads());

        this.evaluationsRepo = new EvaluationsRepo(db);
        this.analysesRepo = new AnalysesRepo(db);
        this.clustersRepo = new ClustersRepo(db);
        this.themesRepo = new ThemesRepo(db);
        this.categorizer = new ThemeCategorizer(themesRepo);
        this.insightMiner = new InsightMiner(new AnalyticsRepo(db), new InsightsRepo(db), clock);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "analysis-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public EvaluationsRepo evaluations() { return evaluationsRepo; }

    public AnalysesRepo analyses() { return analysesRepo; }

    public ThemeCategorizer themeCategorizer() { return categorizer; }

    public InsightMiner insightMiner() { return insightMiner; }

    public BatchSummary lastSummary() { return lastSummary; }

    /* ---------- Public API ---------- */

    /**
     * Analyses the non-blank evaluations and persists the results atomically. Evaluations without
     * an id are stored in the same transaction.
     *
     * @throws survey.model.repository.PersistenceException if the batch could not be committed
     */
    public List<Analysis> processBatch(List<EvaluationText> evaluations) {
        Instant started = clock.instant();

        // 1) skip blanks
        List<EvaluationText> kept = new ArrayList<>(evaluations.size());
        for (var e : evaluations) {
            if (e.hasComment()) kept.add(e);
            else log.info("skipping evaluation {} without comment", e.evaluationId());
        }
        if (kept.isEmpty()) {
            lastSummary = new BatchSummary(evaluations.size(), 0, evaluations.size(), 0, 0, started, clock.instant());
            return List.of();
        }

        // 2) per-item analysis
        List<ItemResult> items = analyzeItems(kept);

        // 3) batch clustering
        List<String> texts = kept.stream().map(EvaluationText::comment).toList();
        ClusteringResult clustering = clusterer.cluster(texts, clusterMethod, OptionalInt.empty());
        Instant now = clock.instant();
        List<PersistedCluster> clusters = clustering.isEmpty() ? List.of()
                : clusterer.summarize(clustering.labels(), clustering.embeddings(),
                        items.stream().map(ItemResult::themes).toList(),
                        items.stream().map(i -> i.sentiment().score()).toList(), now);

        // 4) theme counts, coalesced per (theme, language)
        Map<Map.Entry<String, LanguageLabel>, Integer> themeCounts = new LinkedHashMap<>();
        for (var item : items) {
            for (String t : item.themes()) themeCounts.merge(Map.entry(t, item.language()), 1, Integer::sum);
        }

        // 5) persist
        List<Analysis> saved = db.inTransaction(con -> {
            Map<Integer, Long> clusterIds = new HashMap<>();
            for (var c : clusters) clusterIds.put(c.number(), clustersRepo.insert(con, c).id());

            List<Analysis> out = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                ItemResult item = items.get(i);
                EvaluationText ev = item.evaluation();
                if (ev.id() == null) ev = evaluationsRepo.save(con, ev);

                Long clusterId = null;
                float[] embedding = null;
                if (!clustering.isEmpty()) {
                    clusterId = clusterIds.get(clustering.labels()[i]);
                    embedding = clustering.embeddings()[i];
                }
                out.add(analysesRepo.save(con, new Analysis(null, ev.id(), item.language(), item.detected(),
                        item.languageConfidence(), item.sentiment(), item.themes(), clusterId, embedding,
                        now, Analysis.MODEL_VERSION)));
            }
            for (var e : themeCounts.entrySet()) {
                themesRepo.increment(con, e.getKey().getKey(), e.getKey().getValue(), e.getValue(), now);
            }
            return out;
        });

        lastSummary = new BatchSummary(evaluations.size(), saved.size(), evaluations.size() - saved.size(),
                clusters.size(), themeCounts.size(), started, clock.instant());
        log.info("batch done: analyzed={} skipped={} clusters={} themes={}",
                saved.size(), evaluations.size() - saved.size(), clusters.size(), themeCounts.size());
        return saved;
    }

    /** Single-item form of {@link #processBatch}; a blank comment is rejected. */
    public Analysis processEvaluation(EvaluationText evaluation) {
        if (!evaluation.hasComment()) {
            throw new IllegalArgumentException("evaluation " + evaluation.evaluationId() + " has no comment");
        }
        return processBatch(List.of(evaluation)).get(0);
    }

    /** Clusters of every run, latest first. */
    public List<PersistedCluster> clusters() {
        return clustersRepo.findAll();
    }

    /* ---------- Internal ---------- */

    record ItemResult(EvaluationText evaluation, LanguageLabel language, LanguageLabel detected,
                      double languageConfidence, SentimentResult sentiment, List<String> themes) {}

    private List<ItemResult> analyzeItems(List<EvaluationText> kept) {
        List<Callable<ItemResult>> tasks = new ArrayList<>(kept.size());
        for (var e : kept) tasks.add(() -> analyzeOne(e));

        List<Future<ItemResult>> futures;
        try {
            futures = workers.invokeAll(tasks);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while analysing batch", ex);
        }

        List<ItemResult> out = new ArrayList<>(kept.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).get());
            } catch (ExecutionException ex) {
                log.warn("analysis of evaluation {} failed, storing neutral result: {}",
                        kept.get(i).evaluationId(), ex.getCause().toString());
                out.add(degraded(kept.get(i)));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while analysing batch", ex);
            }
        }
        return out;
    }

    private ItemResult analyzeOne(EvaluationText e) {
        String text = e.comment();
        LanguageLabel detected = classifier.detect(text);
        double confidence = classifier.confidence(text, detected);
        LanguageLabel language = e.declared().orElse(detected);

        SentimentResult sentiment = scorer.analyze(text, language);
        List<String> themes = extractor.extractOne(text, language, extractor.topN());
        return new ItemResult(e, language, detected, confidence, sentiment, themes);
    }

    private static ItemResult degraded(EvaluationText e) {
        LanguageLabel language = e.declared().orElse(LanguageLabel.FR);
        return new ItemResult(e, language, LanguageLabel.FR, 0.5,
                new SentimentResult(Polarity.NEUTRAL, 0.0, 0.0, "neutral (failed)",
                        SentimentResult.STRATEGY_NONE),
                List.of());
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
