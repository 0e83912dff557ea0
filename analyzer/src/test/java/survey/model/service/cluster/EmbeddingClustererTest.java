package survey.model.service.cluster;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;
import survey.model.domain.PersistedCluster;
import survey.model.service.config.AppConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EmbeddingClustererTest {

    private static AppConfig.Clustering settings(OptionalInt defaultClusters) {
        return new AppConfig.Clustering("kmeans", 10, defaultClusters, 42, 10, 5, 300, 1.0, 5);
    }

    /** Thirty texts t0..t29 whose vectors form three clouds of ten. */
    private static Map<String, float[]> cloudVectors() {
        float[][] pts = Clouds.points(10, 9);
        Map<String, float[]> m = new LinkedHashMap<>();
        for (int i = 0; i < pts.length; i++) m.put("t" + i, pts[i]);
        return m;
    }

    @Test
    void cluster_shouldGroupTextsWithRequestedK() {
        Map<String, float[]> vectors = cloudVectors();
        EmbeddingClusterer clusterer = new EmbeddingClusterer(new FakeEmbeddingModel(vectors), settings(OptionalInt.empty()));

        ClusteringResult r = clusterer.cluster(new ArrayList<>(vectors.keySet()), "kmeans", OptionalInt.of(3));

        assertThat(r.labels()).hasSize(30);
        assertThat(r.embeddings()).hasNumberOfRows(30);
        assertThat(r.info()).containsEntry("method", "kmeans").containsEntry("n_clusters", 3);
        assertThat(r.info().get("cluster_sizes")).isEqualTo(Map.of(0, 10, 1, 10, 2, 10));
    }

    @Test
    void cluster_shouldRunDbscanWhenAsked() {
        Map<String, float[]> vectors = cloudVectors();
        vectors.put("outlier", new float[]{50f, 50f});
        EmbeddingClusterer clusterer = new EmbeddingClusterer(new FakeEmbeddingModel(vectors), settings(OptionalInt.empty()));

        ClusteringResult r = clusterer.cluster(new ArrayList<>(vectors.keySet()), "dbscan", OptionalInt.empty());

        assertThat(r.info()).containsEntry("method", "dbscan").containsEntry("n_clusters", 3).containsEntry("n_noise", 1);
        assertThat(r.labels()[30]).isEqualTo(ClusteringResult.NOISE);
    }

    @Test
    void cluster_shouldFallBackToKmeansForUnknownMethod() {
        Map<String, float[]> vectors = cloudVectors();
        EmbeddingClusterer clusterer = new EmbeddingClusterer(new FakeEmbeddingModel(vectors), settings(OptionalInt.of(3)));

        ClusteringResult r = clusterer.cluster(new ArrayList<>(vectors.keySet()), "spectral", OptionalInt.empty());

        assertThat(r.info()).containsEntry("method", "kmeans").containsEntry("n_clusters", 3);
    }

    @Test
    void cluster_shouldReturnEmptyResultWhenEmbeddingFails() {
        FakeEmbeddingModel model = FakeEmbeddingModel.failing();
        EmbeddingClusterer clusterer = new EmbeddingClusterer(model, settings(OptionalInt.of(3)));

        ClusteringResult r = clusterer.cluster(List.of("a", "b", "c"), "kmeans", OptionalInt.empty());

        assertThat(r.isEmpty()).isTrue();
        assertThat(model.calls()).isEqualTo(1);
    }

    @Test
    void embed_shouldRejectVectorCountMismatch() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embedAll(anyList())).thenReturn(Response.from(List.of()));
        EmbeddingClusterer clusterer = new EmbeddingClusterer(model, settings(OptionalInt.empty()));

        assertThat(clusterer.embed(List.of("a", "b"))).isEmpty();
        assertThat(clusterer.embed(List.of())).isEmpty();
    }

    @Test
    void resolveK_shouldPreferExplicitThenDefaultAndClampToPointCount() {
        double[][] three = {{0}, {1}, {2}};
        EmbeddingClusterer withDefault = new EmbeddingClusterer(FakeEmbeddingModel.failing(), settings(OptionalInt.of(2)));

        assertThat(withDefault.resolveK(three, OptionalInt.of(5))).isEqualTo(3);
        assertThat(withDefault.resolveK(three, OptionalInt.empty())).isEqualTo(2);
        assertThat(withDefault.resolveK(three, OptionalInt.of(0))).isEqualTo(1);

        EmbeddingClusterer elbow = new EmbeddingClusterer(FakeEmbeddingModel.failing(), settings(OptionalInt.empty()));
        assertThat(elbow.resolveK(three, OptionalInt.empty())).isEqualTo(3);
    }

    @Test
    void clusterEmbeddings_shouldPutEveryPointInClusterZeroWhenKmeansFails() {
        EmbeddingClusterer clusterer = new EmbeddingClusterer(FakeEmbeddingModel.failing(), settings(OptionalInt.of(2)));
        float[][] ragged = {{1f, 2f}, {3f}, {4f, 5f}};

        ClusteringResult r = clusterer.clusterEmbeddings(ragged, "kmeans", OptionalInt.empty());

        assertThat(r.labels()).containsExactly(0, 0, 0);
        assertThat(r.info()).isEmpty();
    }

    @Test
    void summarize_shouldDescribeEachNonNoiseCluster() {
        EmbeddingClusterer clusterer = new EmbeddingClusterer(FakeEmbeddingModel.failing(), settings(OptionalInt.empty()));
        Instant now = Instant.parse("2024-03-01T10:00:00Z");

        List<PersistedCluster> out = clusterer.summarize(
                new int[]{0, 1, 0, ClusteringResult.NOISE},
                new float[][]{{1f, 1f}, {5f, 5f}, {3f, 3f}, {9f, 9f}},
                List.of(List.of("salle", "formateur"), List.of("utile"), List.of("salle"), List.of("bruit")),
                List.of(0.5, -0.8, 0.1, 0.0),
                now);

        assertThat(out).hasSize(2);
        PersistedCluster first = out.get(0);
        assertThat(first.label()).isEqualTo("Cluster 0");
        assertThat(first.size()).isEqualTo(2);
        assertThat(first.representativeThemes()).containsExactly("salle", "formateur");
        assertThat(first.avgSentiment()).isCloseTo(0.3, within(1e-9));
        assertThat(first.centroid()).containsExactly(2f, 2f);
        assertThat(first.createdAt()).isEqualTo(now);
        assertThat(out.get(1).number()).isEqualTo(1);
        assertThat(out.get(1).avgSentiment()).isEqualTo(-0.8);
    }

    @Test
    void summarize_shouldRejectMismatchedLengths() {
        EmbeddingClusterer clusterer = new EmbeddingClusterer(FakeEmbeddingModel.failing(), settings(OptionalInt.empty()));

        assertThatThrownBy(() -> clusterer.summarize(new int[]{0}, new float[0][], List.of(), List.of(), Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
