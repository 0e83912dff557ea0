package survey.model.service.cluster;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/** Density clustering over Euclidean distance; a neighbourhood includes the point itself. */
final class Dbscan {
    private final double eps;
    private final int minSamples;

    Dbscan(double eps, int minSamples) {
        if (eps <= 0) throw new IllegalArgumentException("eps must be positive: " + eps);
        this.eps = eps;
        this.minSamples = Math.max(1, minSamples);
    }

    int[] fit(double[][] x) {
        int n = x.length;
        double eps2 = eps * eps;
        List<int[]> neighbours = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int[] buf = new int[n];
            int m = 0;
            for (int j = 0; j < n; j++) {
                if (Standardizer.squaredDistance(x[i], x[j]) <= eps2) buf[m++] = j;
            }
            neighbours.add(Arrays.copyOf(buf, m));
        }

        int[] labels = new int[n];
        Arrays.fill(labels, ClusteringResult.NOISE);
        boolean[] visited = new boolean[n];
        int cluster = 0;

        for (int i = 0; i < n; i++) {
            if (visited[i]) continue;
            visited[i] = true;
            if (neighbours.get(i).length < minSamples) continue;

            labels[i] = cluster;
            Deque<Integer> queue = new ArrayDeque<>();
            for (int j : neighbours.get(i)) queue.add(j);
            while (!queue.isEmpty()) {
                int j = queue.poll();
                if (labels[j] == ClusteringResult.NOISE) labels[j] = cluster;
                if (visited[j]) continue;
                visited[j] = true;
                if (neighbours.get(j).length >= minSamples) {
                    for (int q : neighbours.get(j)) queue.add(q);
                }
            }
            cluster++;
        }
        return labels;
    }
}
