package com.pulsebrief.insights.stats;

/**
 * Welch's unequal-variance two-sample t-test plus Cohen's d on the pooled deviation.
 */
public record WelchTest(double t, double degreesOfFreedom, double pValue, double cohensD) {

    /** Effect size reported when both windows are constant but differ. */
    static final double MAX_EFFECT = 10d;

    public static WelchTest compare(double[] current, double[] prior) {
        if (current.length < 2 || prior.length < 2) {
            throw new IllegalArgumentException("both samples need at least two observations");
        }
        double meanCurrent = Statistics.mean(current);
        double meanPrior = Statistics.mean(prior);
        double varCurrent = Statistics.variance(current);
        double varPrior = Statistics.variance(prior);
        double seCurrent = varCurrent / current.length;
        double sePrior = varPrior / prior.length;
        double standardError = Math.sqrt(seCurrent + sePrior);
        double diff = meanCurrent - meanPrior;

        double pooled = Math.sqrt(((current.length - 1) * varCurrent + (prior.length - 1) * varPrior)
                / (current.length + prior.length - 2));
        double cohensD = pooled == 0d ? (diff == 0d ? 0d : Math.copySign(MAX_EFFECT, diff)) : diff / pooled;

        if (standardError == 0d) {
            // Both windows are constant: any difference is exact.
            double t = diff == 0d ? 0d : Math.copySign(Double.MAX_VALUE, diff);
            return new WelchTest(t, current.length + prior.length - 2, diff == 0d ? 1d : 0d, cohensD);
        }
        double t = diff / standardError;
        double numerator = Math.pow(seCurrent + sePrior, 2);
        double denominator = (current.length > 1 ? seCurrent * seCurrent / (current.length - 1) : 0d)
                + (prior.length > 1 ? sePrior * sePrior / (prior.length - 1) : 0d);
        double df = denominator == 0d ? current.length + prior.length - 2 : numerator / denominator;
        return new WelchTest(t, df, Distributions.studentTwoSidedPValue(t, df), cohensD);
    }
}
