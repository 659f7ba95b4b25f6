package io.trading.analytics.cluster;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationClustererTest {

    private final CorrelationClusterer clusterer = new CorrelationClusterer();

    @Test
    void testGreedyClusters() {
        Map<String, double[]> prices = new LinkedHashMap<>();
        prices.put("A", new double[]{1, 2, 3, 4, 5});
        prices.put("B", new double[]{2, 4, 6, 8, 10});
        prices.put("C", new double[]{5, 4, 3, 2, 1});
        prices.put("D", new double[]{1, 2});

        List<List<String>> clusters = clusterer.cluster(prices, 0.7);

        assertEquals(List.of(List.of("A", "B"), List.of("C"), List.of("D")), clusters);
    }

    @Test
    void testMatrixDefaults() {
        double[][] matrix = clusterer.correlationMatrix(List.of(
            new double[]{1, 2, 3},
            new double[]{1, 2},
            new double[0]
        ));

        for (int i = 0; i < 3; i++) {
            assertEquals(1.0, matrix[i][i]);
        }
        assertEquals(0.0, matrix[0][1]);
        assertEquals(0.0, matrix[1][2]);
        assertEquals(matrix[0][2], matrix[2][0]);
    }

    @Test
    void testAbsorbedInstrumentsDoNotSeed() {
        // corr(A,B) = corr(B,C) = 0.943, corr(A,C) = 0.886
        Map<String, double[]> prices = new LinkedHashMap<>();
        prices.put("A", new double[]{1, 2, 3, 4, 5, 6});
        prices.put("B", new double[]{1, 2, 3, 4, 6, 5});
        prices.put("C", new double[]{2, 1, 3, 4, 6, 5});

        Map<String, List<String>> named = clusterer.namedClusters(prices, 0.9);

        assertEquals(List.of("A", "B"), named.get("cluster_0"));
        assertEquals(List.of("C"), named.get("cluster_1"));
        assertEquals(2, named.size());
    }

    @Test
    void testSingleClusterAtLowThreshold() {
        Map<String, double[]> prices = new LinkedHashMap<>();
        prices.put("A", new double[]{1, 2, 3, 4, 5, 6});
        prices.put("B", new double[]{1, 2, 3, 4, 6, 5});
        prices.put("C", new double[]{2, 1, 3, 4, 6, 5});

        assertEquals(List.of(List.of("A", "B", "C")), clusterer.cluster(prices, 0.5));
    }
}
