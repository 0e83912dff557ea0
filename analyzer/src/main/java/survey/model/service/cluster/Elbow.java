package survey.model.service.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks k from the inertia curve over k = 2..min(maxK, n/2): the k after the largest absolute
 * inertia drop. A coarse proxy for the elbow, kept for compatibility with earlier results.
 */
final class Elbow {
    private static final Logger log = LoggerFactory.getLogger(Elbow.class);

    static final int MIN_POINTS = 10;
    static final int SMALL_SAMPLE_K = 3;

    private Elbow() {}

    static int chooseK(double[][] x, int maxK, int nInit, int maxIterations, long seed) {
        int n = x.length;
        if (n < MIN_POINTS) return Math.min(SMALL_SAMPLE_K, n);

        int upper = Math.min(maxK, n / 2);
        List<Double> inertias = new ArrayList<>();
        for (int k = 2; k <= upper; k++) {
            inertias.add(new KMeans(k, nInit, maxIterations, seed).fit(x).inertia());
        }
        if (inertias.size() < 2) return SMALL_SAMPLE_K;

        int bestIdx = 0;
        double bestDrop = -1;
        for (int i = 0; i + 1 < inertias.size(); i++) {
            double drop = Math.abs(inertias.get(i + 1) - inertias.get(i));
            if (drop > bestDrop) { bestDrop = drop; bestIdx = i; }
        }
        int k = bestIdx + 2;
        log.debug("elbow inertias={} -> k={}", inertias, k);
        return k;
    }
}
