package survey.model.service.cluster;

import java.util.Map;

/**
 * Output of one clustering run. {@code labels[i]} is the cluster of {@code embeddings[i]},
 * or {@link #NOISE}.
 */
public record ClusteringResult(float[][] embeddings, int[] labels, Map<String, Object> info) {
    public static final int NOISE = -1;

    public static ClusteringResult empty() {
        return new ClusteringResult(new float[0][], new int[0], Map.of());
    }

    public boolean isEmpty() { return labels.length == 0; }
}
