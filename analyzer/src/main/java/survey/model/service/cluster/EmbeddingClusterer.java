package survey.model.service.cluster;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.PersistedCluster;
import survey.model.service.config.AppConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Embeds comments and groups them. K-Means runs on standardised vectors with k taken from the
 * caller, then the configured default, then the elbow heuristic. DBSCAN runs on raw vectors and
 * may leave points as {@link ClusteringResult#NOISE}.
 */
public class EmbeddingClusterer {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClusterer.class);

    public static final int REPRESENTATIVE_THEMES = 5;

    private final EmbeddingModel model;
    private final AppConfig.Clustering settings;

    public EmbeddingClusterer(EmbeddingModel model, AppConfig.Clustering settings) {
        this.model = model;
        this.settings = settings;
    }

    /** Empty on empty input or on any embedding failure. */
    public float[][] embed(List<String> texts) {
        if (texts.isEmpty()) return new float[0][];
        try {
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            List<Embedding> embeddings = model.embedAll(segments).content();
            if (embeddings == null || embeddings.size() != texts.size()) {
                log.warn("embedding model returned {} vectors for {} texts", embeddings == null ? 0 : embeddings.size(), texts.size());
                return new float[0][];
            }
            float[][] out = new float[embeddings.size()][];
            for (int i = 0; i < out.length; i++) out[i] = embeddings.get(i).vector();
            return out;
        } catch (RuntimeException e) {
            log.warn("embedding failed, clustering skipped: {}", e.getMessage());
            return new float[0][];
        }
    }

    public ClusteringResult cluster(List<String> texts, String method, OptionalInt nClusters) {
        float[][] embeddings = embed(texts);
        if (embeddings.length == 0) return ClusteringResult.empty();
        return clusterEmbeddings(embeddings, method, nClusters);
    }

    public ClusteringResult clusterEmbeddings(float[][] embeddings, String method, OptionalInt nClusters) {
        if (embeddings.length == 0) return ClusteringResult.empty();
        ClusterMethod m = ClusterMethod.parse(method).orElseGet(() -> {
            log.warn("unknown clustering method '{}', using kmeans", method);
            return ClusterMethod.KMEANS;
        });
        return m == ClusterMethod.DBSCAN ? dbscan(embeddings) : kmeans(embeddings, nClusters);
    }

    private ClusteringResult kmeans(float[][] embeddings, OptionalInt nClusters) {
        int n = embeddings.length;
        try {
            double[][] x = Standardizer.standardize(embeddings);
            int k = resolveK(x, nClusters);
            KMeans.Fit fit = new KMeans(k, settings.nInit(), settings.maxIterations(), settings.randomSeed()).fit(x);

            Map<String, Object> info = new LinkedHashMap<>();
            info.put("method", ClusterMethod.KMEANS.code());
            info.put("n_clusters", k);
            info.put("inertia", fit.inertia());
            info.put("cluster_sizes", sizes(fit.labels()));
            log.info("kmeans: {} points into {} clusters (inertia {})", n, k, String.format("%.3f", fit.inertia()));
            return new ClusteringResult(embeddings, fit.labels(), info);
        } catch (RuntimeException e) {
            log.warn("kmeans failed, assigning every point to cluster 0: {}", e.getMessage());
            return new ClusteringResult(embeddings, new int[n], Map.of());
        }
    }

    int resolveK(double[][] x, OptionalInt nClusters) {
        int k;
        if (nClusters.isPresent()) k = nClusters.getAsInt();
        else if (settings.defaultClusters().isPresent()) k = settings.defaultClusters().getAsInt();
        else k = Elbow.chooseK(x, settings.maxClusters(), settings.elbowNInit(), settings.maxIterations(), settings.randomSeed());
        return Math.max(1, Math.min(k, x.length));
    }

    private ClusteringResult dbscan(float[][] embeddings) {
        int n = embeddings.length;
        try {
            int[] labels = new Dbscan(settings.dbscanEps(), settings.dbscanMinSamples()).fit(Standardizer.toDouble(embeddings));
            Map<Integer, Integer> sizes = sizes(labels);
            int noise = sizes.getOrDefault(ClusteringResult.NOISE, 0);
            sizes.remove(ClusteringResult.NOISE);

            Map<String, Object> info = new LinkedHashMap<>();
            info.put("method", ClusterMethod.DBSCAN.code());
            info.put("n_clusters", sizes.size());
            info.put("n_noise", noise);
            info.put("cluster_sizes", sizes);
            log.info("dbscan: {} points, {} clusters, {} noise", n, sizes.size(), noise);
            return new ClusteringResult(embeddings, labels, info);
        } catch (RuntimeException e) {
            log.warn("dbscan failed, marking every point as noise: {}", e.getMessage());
            int[] labels = new int[n];
            Arrays.fill(labels, ClusteringResult.NOISE);
            return new ClusteringResult(embeddings, labels, Map.of());
        }
    }

    private static Map<Integer, Integer> sizes(int[] labels) {
        Map<Integer, Integer> sizes = new TreeMap<>();
        for (int l : labels) sizes.merge(l, 1, Integer::sum);
        return sizes;
    }

    /**
     * One cluster per non-noise label, in label order: member count, the most frequent member themes
     * (ties by first appearance), mean sentiment score and mean embedding.
     */
    public List<PersistedCluster> summarize(int[] labels, float[][] embeddings, List<List<String>> themes,
                                            List<Double> scores, Instant createdAt) {
        if (labels.length != embeddings.length || labels.length != themes.size() || labels.length != scores.size()) {
            throw new IllegalArgumentException("labels, embeddings, themes and scores must have the same length");
        }
        Map<Integer, List<Integer>> members = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != ClusteringResult.NOISE) members.computeIfAbsent(labels[i], x -> new ArrayList<>()).add(i);
        }

        List<PersistedCluster> out = new ArrayList<>(members.size());
        for (var e : members.entrySet()) {
            List<Integer> idx = e.getValue();

            Map<String, Integer> themeCounts = new LinkedHashMap<>();
            for (int i : idx) for (String t : themes.get(i)) themeCounts.merge(t, 1, Integer::sum);
            List<String> top = themeCounts.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                    .limit(REPRESENTATIVE_THEMES)
                    .map(Map.Entry::getKey)
                    .toList();

            double avg = idx.stream().mapToDouble(scores::get).average().orElse(0.0);

            int d = embeddings[idx.get(0)].length;
            float[] centroid = new float[d];
            for (int i : idx) for (int j = 0; j < d; j++) centroid[j] += embeddings[i][j];
            for (int j = 0; j < d; j++) centroid[j] /= idx.size();

            out.add(new PersistedCluster(null, "Cluster " + e.getKey(), e.getKey(), idx.size(), top, avg, centroid, createdAt));
        }
        return out;
    }
}
