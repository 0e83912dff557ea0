package survey.model.service.cluster;

/** Per-dimension zero mean, unit (population) variance. Constant dimensions are only centred. */
final class Standardizer {
    private Standardizer() {}

    static double[][] standardize(float[][] x) {
        int n = x.length;
        if (n == 0) return new double[0][];
        int d = x[0].length;
        double[] mean = new double[d];
        double[] var = new double[d];
        for (float[] row : x) {
            if (row.length != d) throw new IllegalArgumentException("ragged embeddings: " + row.length + " vs " + d);
            for (int j = 0; j < d; j++) mean[j] += row[j];
        }
        for (int j = 0; j < d; j++) mean[j] /= n;
        for (float[] row : x) {
            for (int j = 0; j < d; j++) {
                double dv = row[j] - mean[j];
                var[j] += dv * dv;
            }
        }
        double[][] out = new double[n][d];
        for (int j = 0; j < d; j++) {
            double sd = Math.sqrt(var[j] / n);
            double scale = sd == 0.0 ? 1.0 : sd;
            for (int i = 0; i < n; i++) out[i][j] = (x[i][j] - mean[j]) / scale;
        }
        return out;
    }

    static double[][] toDouble(float[][] x) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = new double[x[i].length];
            for (int j = 0; j < x[i].length; j++) out[i][j] = x[i][j];
        }
        return out;
    }

    static double squaredDistance(double[] a, double[] b) {
        double s = 0;
        for (int j = 0; j < a.length; j++) {
            double d = a[j] - b[j];
            s += d * d;
        }
        return s;
    }
}
