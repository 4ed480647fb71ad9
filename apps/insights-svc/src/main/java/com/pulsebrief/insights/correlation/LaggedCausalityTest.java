package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.stats.Distributions;
import com.pulsebrief.insights.stats.LeastSquares;
import org.springframework.stereotype.Component;

/**
 * Granger-style F-test: does adding {@code cause} at lags L..L+k-1 improve an
 * autoregression of {@code effect} on its own k lags?
 */
@Component
public class LaggedCausalityTest {

    /**
     * @return p-value in [0,1]; 1 when the test cannot be evaluated
     */
    public double pValue(double[] cause, double[] effect, int lag, int order) {
        int n = Math.min(cause.length, effect.length);
        int start = Math.max(order, lag + order - 1);
        int rows = n - start;
        int unrestrictedParams = 2 * order + 1;
        if (rows <= unrestrictedParams + 1) {
            return 1d;
        }
        double[][] restricted = new double[rows][order];
        double[][] unrestricted = new double[rows][2 * order];
        double[] y = new double[rows];
        for (int r = 0; r < rows; r++) {
            int t = start + r;
            y[r] = effect[t];
            for (int j = 0; j < order; j++) {
                restricted[r][j] = effect[t - 1 - j];
                unrestricted[r][j] = effect[t - 1 - j];
                unrestricted[r][order + j] = cause[t - lag - j];
            }
        }
        double rssRestricted;
        double rssUnrestricted;
        try {
            rssRestricted = LeastSquares.fit(restricted, y).residualSumOfSquares();
            rssUnrestricted = LeastSquares.fit(unrestricted, y).residualSumOfSquares();
        } catch (ArithmeticException ex) {
            return 1d;
        }
        int dfDenominator = rows - unrestrictedParams;
        if (rssUnrestricted <= 1e-12d) {
            return rssRestricted > 1e-12d ? 0d : 1d;
        }
        double f = ((rssRestricted - rssUnrestricted) / order) / (rssUnrestricted / dfDenominator);
        return Distributions.fSurvival(f, order, dfDenominator);
    }
}
