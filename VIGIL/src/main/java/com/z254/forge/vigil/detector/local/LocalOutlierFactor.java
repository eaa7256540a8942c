package com.z254.forge.vigil.detector.local;

import com.z254.forge.vigil.domain.model.FeatureVector;

import java.util.Arrays;
import java.util.List;

/**
 * Batch local outlier factor over a set of points.
 * <p>
 * Neighbourhoods exclude the point itself but keep exact duplicates. Local reachability
 * density is {@code 1 / (mean reachability distance + 1e-10)} and the factor of a point
 * is the mean density of its neighbours divided by its own density. Results are returned
 * as negative factors so that lower means more anomalous.
 */
public final class LocalOutlierFactor {

    private static final double DENSITY_EPSILON = 1e-10;

    private LocalOutlierFactor() {
    }

    /**
     * Negative outlier factor of every point.
     *
     * @param points    at least two points
     * @param neighbors requested neighbourhood size, capped at {@code points.size() - 1}
     */
    public static double[] negativeOutlierFactors(List<FeatureVector> points, int neighbors) {
        int n = points.size();
        if (n < 2) {
            throw new IllegalArgumentException("Local outlier factor needs at least two points");
        }
        int k = Math.max(1, Math.min(neighbors, n - 1));

        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = points.get(i).distanceTo(points.get(j));
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }

        int[][] neighborhoods = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            neighborhoods[i] = nearest(distances[i], i, k);
            kDistance[i] = distances[i][neighborhoods[i][k - 1]];
        }

        double[] density = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0.0;
            for (int o : neighborhoods[i]) {
                reach += Math.max(distances[i][o], kDistance[o]);
            }
            density[i] = 1.0 / (reach / k + DENSITY_EPSILON);
        }

        double[] negativeFactors = new double[n];
        for (int i = 0; i < n; i++) {
            double neighborDensity = 0.0;
            for (int o : neighborhoods[i]) {
                neighborDensity += density[o];
            }
            negativeFactors[i] = -(neighborDensity / k) / density[i];
        }
        return negativeFactors;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values   sample
     * @param fraction in [0, 1]
     */
    public static double percentile(double[] values, double fraction) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = (sorted.length - 1) * fraction;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    // Ties are broken by index so the neighbourhood is deterministic.
    private static int[] nearest(double[] row, int self, int k) {
        Integer[] candidates = new Integer[row.length - 1];
        int c = 0;
        for (int j = 0; j < row.length; j++) {
            if (j != self) {
                candidates[c++] = j;
            }
        }
        Arrays.sort(candidates, (a, b) -> {
            int byDistance = Double.compare(row[a], row[b]);
            return byDistance != 0 ? byDistance : Integer.compare(a, b);
        });
        int[] result = new int[k];
        for (int i = 0; i < k; i++) {
            result[i] = candidates[i];
        }
        return result;
    }
}
