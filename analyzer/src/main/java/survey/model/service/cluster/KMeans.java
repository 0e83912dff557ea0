package survey.model.service.cluster;

import java.util.Arrays;
import java.util.Random;

/**
 * Lloyd's algorithm with k-means++ seeding. Runs {@code nInit} seedings from one seeded
 * {@link Random} and keeps the lowest inertia, so results are reproducible for a given seed.
 */
final class KMeans {
    record Fit(int[] labels, double[][] centroids, double inertia) {}

    private final int k;
    private final int nInit;
    private final int maxIterations;
    private final long seed;

    KMeans(int k, int nInit, int maxIterations, long seed) {
        if (k < 1) throw new IllegalArgumentException("k must be >= 1: " + k);
        this.k = k;
        this.nInit = Math.max(1, nInit);
        this.maxIterations = Math.max(1, maxIterations);
        this.seed = seed;
    }

    Fit fit(double[][] x) {
        if (x.length < k) throw new IllegalArgumentException("k=" + k + " exceeds " + x.length + " points");
        Random rnd = new Random(seed);
        Fit best = null;
        for (int run = 0; run < nInit; run++) {
            Fit f = lloyd(x, seedPlusPlus(x, rnd));
            if (best == null || f.inertia() < best.inertia()) best = f;
        }
        return best;
    }

    private double[][] seedPlusPlus(double[][] x, Random rnd) {
        int n = x.length;
        double[][] centers = new double[k][];
        centers[0] = x[rnd.nextInt(n)].clone();
        double[] d2 = new double[n];
        for (int i = 0; i < n; i++) d2[i] = Standardizer.squaredDistance(x[i], centers[0]);

        for (int c = 1; c < k; c++) {
            double total = 0;
            for (double v : d2) total += v;
            int pick;
            if (total <= 0) {
                pick = rnd.nextInt(n);
            } else {
                double r = rnd.nextDouble() * total;
                pick = n - 1;
                for (int i = 0; i < n; i++) {
                    r -= d2[i];
                    if (r <= 0) { pick = i; break; }
                }
            }
            centers[c] = x[pick].clone();
            for (int i = 0; i < n; i++) {
                d2[i] = Math.min(d2[i], Standardizer.squaredDistance(x[i], centers[c]));
            }
        }
        return centers;
    }

    private Fit lloyd(double[][] x, double[][] centroids) {
        int n = x.length;
        int[] labels = new int[n];
        Arrays.fill(labels, -1);

        for (int iter = 0; iter < maxIterations; iter++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int c = nearest(x[i], centroids);
                if (c != labels[i]) { labels[i] = c; changed = true; }
            }
            changed |= refillEmpty(x, labels, centroids);
            centroids = means(x, labels, centroids[0].length);
            if (!changed) break;
        }

        double inertia = 0;
        for (int i = 0; i < n; i++) inertia += Standardizer.squaredDistance(x[i], centroids[labels[i]]);
        return new Fit(labels, centroids, inertia);
    }

    /** An empty cluster takes the point farthest from its centroid, among clusters that can spare one. */
    private boolean refillEmpty(double[][] x, int[] labels, double[][] centroids) {
        int[] sizes = new int[k];
        for (int l : labels) sizes[l]++;
        boolean moved = false;
        for (int c = 0; c < k; c++) {
            if (sizes[c] > 0) continue;
            int far = -1;
            double farDist = -1;
            for (int i = 0; i < x.length; i++) {
                if (sizes[labels[i]] <= 1) continue;
                double d = Standardizer.squaredDistance(x[i], centroids[labels[i]]);
                if (d > farDist) { farDist = d; far = i; }
            }
            if (far < 0) break;
            sizes[labels[far]]--;
            labels[far] = c;
            sizes[c]++;
            moved = true;
        }
        return moved;
    }

    private double[][] means(double[][] x, int[] labels, int d) {
        double[][] sums = new double[k][d];
        int[] counts = new int[k];
        for (int i = 0; i < x.length; i++) {
            counts[labels[i]]++;
            for (int j = 0; j < d; j++) sums[labels[i]][j] += x[i][j];
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) continue;
            for (int j = 0; j < d; j++) sums[c][j] /= counts[c];
        }
        return sums;
    }

    private static int nearest(double[] p, double[][] centroids) {
        int best = 0;
        double bestD = Double.MAX_VALUE;
        for (int c = 0; c < centroids.length; c++) {
            double d = Standardizer.squaredDistance(p, centroids[c]);
            if (d < bestD) { bestD = d; best = c; }
        }
        return best;
    }
}
