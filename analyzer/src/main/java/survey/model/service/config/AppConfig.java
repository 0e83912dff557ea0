package survey.model.service.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import survey.model.domain.LanguageLabel;

import java.io.File;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Settings read from {@code config/analyzer.conf} (if present) on top of the classpath
 * {@code reference.conf}.
 */
public final class AppConfig {
    public static final String OVERRIDE_FILE = "config/analyzer.conf";

    public final String dbPath;
    public final Pipeline pipeline;
    public final Language language;
    public final Sentiment sentiment;
    public final Embedding embedding;
    public final Clustering clustering;
    public final int categoryTopThemes;

    private AppConfig(String dbPath, Pipeline pipeline, Language language, Sentiment sentiment,
                      Embedding embedding, Clustering clustering, int categoryTopThemes) {
        this.dbPath = dbPath;
        this.pipeline = pipeline;
        this.language = language;
        this.sentiment = sentiment;
        this.embedding = embedding;
        this.clustering = clustering;
        this.categoryTopThemes = categoryTopThemes;
    }

    public static AppConfig load() {
        File f = new File(OVERRIDE_FILE);
        Config root = f.exists()
                ? ConfigFactory.parseFile(f).withFallback(ConfigFactory.load()).resolve()
                : ConfigFactory.load();
        return from(root);
    }

    public static AppConfig from(Config root) {
        Config a = root.getConfig("analyzer");

        Config p = a.getConfig("pipeline");
        Pipeline pipeline = new Pipeline(Math.max(1, p.getInt("workers")), p.getInt("top-themes"));

        Language language = new Language(a.getStringList("language.candidates"));

        Config s = a.getConfig("sentiment");
        Map<LanguageLabel, String> models = new EnumMap<>(LanguageLabel.class);
        for (LanguageLabel l : LanguageLabel.values()) {
            if (s.hasPath("models." + l.name())) models.put(l, s.getString("models." + l.name()));
        }
        Sentiment sentiment = new Sentiment(
                s.getString("endpoint"),
                s.getString("api-key"),
                s.getDuration("timeout"),
                s.getInt("max-chars"),
                s.getDouble("confidence-threshold"),
                models);

        Config e = a.getConfig("embedding");
        Embedding embedding = new Embedding(
                e.getString("endpoint"),
                e.getString("model"),
                e.getString("api-key"),
                Math.max(1, e.getInt("batch-size")),
                e.getDuration("timeout"));

        Config c = a.getConfig("clustering");
        Clustering clustering = new Clustering(
                c.getString("method"),
                c.getInt("max-clusters"),
                c.hasPath("default-clusters") ? OptionalInt.of(c.getInt("default-clusters")) : OptionalInt.empty(),
                c.getLong("random-seed"),
                c.getInt("n-init"),
                c.getInt("elbow-n-init"),
                c.getInt("max-iterations"),
                c.getDouble("dbscan.eps"),
                c.getInt("dbscan.min-samples"));

        return new AppConfig(a.getString("db.path"), pipeline, language, sentiment, embedding, clustering,
                a.getInt("categories.top-themes"));
    }

    public AppConfig withDbPath(String path) {
        return new AppConfig(path, pipeline, language, sentiment, embedding, clustering, categoryTopThemes);
    }

    public record Pipeline(int workers, int topThemes) {}

    public record Language(List<String> candidates) {}

    public record Sentiment(String endpoint, String apiKey, Duration timeout, int maxChars,
                            double confidenceThreshold, Map<LanguageLabel, String> models) {
        public String modelFor(LanguageLabel language) {
            String m = models.get(language);
            return m != null ? m : models.get(LanguageLabel.FR);
        }
    }

    public record Embedding(String endpoint, String model, String apiKey, int batchSize, Duration timeout) {}

    public record Clustering(String method, int maxClusters, OptionalInt defaultClusters, long randomSeed,
                             int nInit, int elbowNInit, int maxIterations, double dbscanEps, int dbscanMinSamples) {}
}
