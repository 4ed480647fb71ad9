package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.anomaly.PreparedSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Two series restricted to their common timestamps, in time order.
 */
record AlignedSeries(double[] left, double[] right) {

    static AlignedSeries of(PreparedSeries a, PreparedSeries b) {
        if (a.frequency() != b.frequency()) {
            return new AlignedSeries(new double[0], new double[0]);
        }
        Map<Instant, Double> byTime = new HashMap<>();
        for (int i = 0; i < b.length(); i++) {
            byTime.put(b.timestampAt(i), b.valueAt(i));
        }
        List<double[]> pairs = new ArrayList<>();
        for (int i = 0; i < a.length(); i++) {
            Double other = byTime.get(a.timestampAt(i));
            if (other != null) {
                pairs.add(new double[] {a.valueAt(i), other});
            }
        }
        double[] left = new double[pairs.size()];
        double[] right = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            left[i] = pairs.get(i)[0];
            right[i] = pairs.get(i)[1];
        }
        return new AlignedSeries(left, right);
    }

    int length() {
        return left.length;
    }
}
