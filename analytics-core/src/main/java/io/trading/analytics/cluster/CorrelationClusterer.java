package io.trading.analytics.cluster;

import io.trading.analytics.indicator.Indicators;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Greedy single-pass grouping of instruments by price correlation.
 *
 * <p>Instruments are visited in the iteration order of the input map. Each unassigned
 * instrument seeds a cluster and absorbs every other unassigned instrument whose
 * correlation to the seed is at least the threshold. The result is deterministic, not
 * optimal.
 */
public class CorrelationClusterer {

    public static final double DEFAULT_MIN_CORRELATION = 0.7;

    /**
     * Builds the full pairwise matrix. The diagonal is 1.0; pairs whose histories are
     * empty, of different length or degenerate are 0.0.
     */
    public double[][] correlationMatrix(List<double[]> series) {
        int n = series.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double value = Indicators.correlation(series.get(i), series.get(j)).orElse(0.0);
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }
        return matrix;
    }

    /**
     * @param pricesByInstrument price histories keyed by instrument, in a stable order
     * @param minCorrelation     minimum correlation to the seed for membership
     * @return clusters in seed order, each listing the seed first
     */
    public List<List<String>> cluster(Map<String, double[]> pricesByInstrument, double minCorrelation) {
        List<String> instruments = new ArrayList<>(pricesByInstrument.keySet());
        double[][] matrix = correlationMatrix(new ArrayList<>(pricesByInstrument.values()));

        Set<Integer> assigned = new LinkedHashSet<>();
        List<List<String>> clusters = new ArrayList<>();
        for (int seed = 0; seed < instruments.size(); seed++) {
            if (assigned.contains(seed)) {
                continue;
            }
            List<String> members = new ArrayList<>();
            members.add(instruments.get(seed));
            assigned.add(seed);

            for (int other = 0; other < instruments.size(); other++) {
                if (!assigned.contains(other) && matrix[seed][other] >= minCorrelation) {
                    members.add(instruments.get(other));
                    assigned.add(other);
                }
            }
            clusters.add(members);
        }
        return clusters;
    }

    /**
     * Same as {@link #cluster(Map, double)} but keyed {@code cluster_0, cluster_1, ...}.
     */
    public Map<String, List<String>> namedClusters(Map<String, double[]> pricesByInstrument, double minCorrelation) {
        Map<String, List<String>> named = new LinkedHashMap<>();
        List<List<String>> clusters = cluster(pricesByInstrument, minCorrelation);
        for (int i = 0; i < clusters.size(); i++) {
            named.put("cluster_" + i, List.copyOf(clusters.get(i)));
        }
        return named;
    }
}
