package survey.model.service.cluster;

import java.util.Random;

/** Well separated 2-d point clouds with uniform jitter, {@code perCloud} points each. */
final class Clouds {
    static final double[][] CENTERS = {{0, 0}, {10, 0}, {0, 10}};

    private Clouds() {}

    static float[][] points(int perCloud, long seed) {
        Random rnd = new Random(seed);
        float[][] out = new float[CENTERS.length * perCloud][];
        for (int c = 0; c < CENTERS.length; c++) {
            for (int i = 0; i < perCloud; i++) {
                out[c * perCloud + i] = new float[]{
                        (float) (CENTERS[c][0] + rnd.nextDouble() * 0.5 - 0.25),
                        (float) (CENTERS[c][1] + rnd.nextDouble() * 0.5 - 0.25)};
            }
        }
        return out;
    }

    static int cloudOf(int index, int perCloud) { return index / perCloud; }
}
