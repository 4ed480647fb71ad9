package com.pulsebrief.insights.stats;

/**
 * Tail probabilities for the Student t and F distributions, computed through the
 * regularized incomplete beta function (continued-fraction evaluation).
 */
public final class Distributions {

    private static final double[] LANCZOS = {
            0.99999999999980993,
            676.5203681218851,
            -1259.1392167224028,
            771.32342877765313,
            -176.61502916214059,
            12.507343278686905,
            -0.13857109526572012,
            9.9843695780195716e-6,
            1.5056327351493116e-7
    };
    private static final int MAX_ITERATIONS = 300;
    private static final double EPSILON = 3e-14;
    private static final double FLOOR = 1e-300;

    private Distributions() {
    }

    /**
     * Two-sided p-value for a t statistic with {@code degreesOfFreedom}.
     */
    public static double studentTwoSidedPValue(double t, double degreesOfFreedom) {
        if (Double.isNaN(t) || degreesOfFreedom <= 0) {
            return 1d;
        }
        if (Double.isInfinite(t)) {
            return 0d;
        }
        double x = degreesOfFreedom / (degreesOfFreedom + t * t);
        return Statistics.clamp(regularizedIncompleteBeta(x, degreesOfFreedom / 2.0, 0.5), 0d, 1d);
    }

    /**
     * Upper tail P(F &gt; f) for an F distribution with (d1, d2) degrees of freedom.
     */
    public static double fSurvival(double f, double d1, double d2) {
        if (Double.isNaN(f) || d1 <= 0 || d2 <= 0) {
            return 1d;
        }
        if (f <= 0) {
            return 1d;
        }
        if (Double.isInfinite(f)) {
            return 0d;
        }
        double x = d2 / (d2 + d1 * f);
        return Statistics.clamp(regularizedIncompleteBeta(x, d2 / 2.0, d1 / 2.0), 0d, 1d);
    }

    public static double regularizedIncompleteBeta(double x, double a, double b) {
        if (x <= 0d) {
            return 0d;
        }
        if (x >= 1d) {
            return 1d;
        }
        double front = Math.exp(logGamma(a + b) - logGamma(a) - logGamma(b)
                + a * Math.log(x) + b * Math.log(1 - x));
        if (x < (a + 1) / (a + b + 2)) {
            return front * betaContinuedFraction(x, a, b) / a;
        }
        return 1d - front * betaContinuedFraction(1 - x, b, a) / b;
    }

    public static double logGamma(double x) {
        if (x < 0.5) {
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1 - x);
        }
        double shifted = x - 1;
        double series = LANCZOS[0];
        double t = shifted + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            series += LANCZOS[i] / (shifted + i);
        }
        return 0.5 * Math.log(2 * Math.PI) + (shifted + 0.5) * Math.log(t) - t + Math.log(series);
    }

    private static double betaContinuedFraction(double x, double a, double b) {
        double qab = a + b;
        double qap = a + 1;
        double qam = a - 1;
        double c = 1d;
        double d = 1d - qab * x / qap;
        d = 1d / nonZero(d);
        double h = d;
        for (int m = 1; m <= MAX_ITERATIONS; m++) {
            int m2 = 2 * m;
            double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
            d = 1d / nonZero(1d + aa * d);
            c = nonZero(1d + aa / c);
            h *= d * c;
            aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
            d = 1d / nonZero(1d + aa * d);
            c = nonZero(1d + aa / c);
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1d) < EPSILON) {
                break;
            }
        }
        return h;
    }

    private static double nonZero(double value) {
        return Math.abs(value) < FLOOR ? FLOOR : value;
    }
}
