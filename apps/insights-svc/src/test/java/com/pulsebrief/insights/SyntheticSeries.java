package com.pulsebrief.insights;

import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.SamplingFrequency;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.IntToDoubleFunction;

/**
 * Seeded series generators shared by the analytical tests.
 */
public final class SyntheticSeries {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private SyntheticSeries() {
    }

    public static KpiSeries daily(String kpi, double[] values) {
        List<KpiPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new KpiPoint(START.plus(Duration.ofDays(i)), values[i]));
        }
        return new KpiSeries(kpi, points, SamplingFrequency.DAILY);
    }

    public static double[] generate(int length, IntToDoubleFunction shape) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = shape.applyAsDouble(i);
        }
        return values;
    }

    /** Compounded growth of {@code monthlyRate} per 30 days with relative Gaussian noise. */
    public static double[] growth(int length, double base, double monthlyRate, double noise, long seed) {
        Random random = new Random(seed);
        return generate(length, i -> base * Math.pow(1 + monthlyRate, i / 30d) * (1 + noise * random.nextGaussian()));
    }

    /** Flat level with a weekly sine pattern and relative Gaussian noise. */
    public static double[] weeklySeasonal(int length, double base, double amplitude, double noise, long seed) {
        Random random = new Random(seed);
        return generate(length, i -> base * (1 + amplitude * Math.sin(2 * Math.PI * i / 7d) + noise * random.nextGaussian()));
    }

    public static Instant day(int index) {
        return START.plus(Duration.ofDays(index));
    }
}
