package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.error.ModelFitException;
import com.pulsebrief.insights.stats.LeastSquares;
import com.pulsebrief.insights.stats.Statistics;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Fits {@link SeasonalModel}: OLS trend line, then per-phase means of the detrended
 * values centred to zero, then the residual deviation.
 */
@Component
public class SeasonalModelFitter {

    public SeasonalModel fit(PreparedSeries series, int endExclusive, Instant fittedAt) {
        int period = series.frequency().seasonalPeriod();
        int minimum = minimumPoints(period);
        if (endExclusive < minimum) {
            throw new ModelFitException(series.kpiName(),
                    "seasonal model needs " + minimum + " points, have " + endExclusive);
        }
        double[] y = series.history(endExclusive);
        LeastSquares.LineFit line = LeastSquares.fitLine(y);
        if (!Double.isFinite(line.slope()) || !Double.isFinite(line.intercept())) {
            throw new ModelFitException(series.kpiName(), "trend fit diverged");
        }

        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int i = 0; i < y.length; i++) {
            double detrended = y[i] - (line.intercept() + line.slope() * i);
            phaseSum[i % period] += detrended;
            phaseCount[i % period]++;
        }
        double[] seasonal = new double[period];
        double seasonalMean = 0d;
        for (int p = 0; p < period; p++) {
            seasonal[p] = phaseCount[p] == 0 ? 0d : phaseSum[p] / phaseCount[p];
            seasonalMean += seasonal[p];
        }
        seasonalMean /= period;
        for (int p = 0; p < period; p++) {
            seasonal[p] -= seasonalMean;
        }

        double[] residuals = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            residuals[i] = y[i] - (line.intercept() + line.slope() * i + seasonal[i % period]);
        }
        double residualStd = Statistics.stdDev(residuals);
        if (!Double.isFinite(residualStd)) {
            throw new ModelFitException(series.kpiName(), "residual deviation is not finite");
        }
        double floor = 1e-6d * Math.max(1d, Math.abs(Statistics.mean(y)));
        return new SeasonalModel(
                series.origin(),
                series.frequency().step(),
                line.intercept(),
                line.slope(),
                seasonal,
                Math.max(residualStd, floor),
                y.length,
                series.timestampAt(endExclusive - 1),
                fittedAt);
    }

    public static int minimumPoints(int period) {
        return 2 * period + 2;
    }
}
