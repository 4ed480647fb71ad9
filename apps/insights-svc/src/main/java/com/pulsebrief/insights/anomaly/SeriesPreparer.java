package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.error.DataQualityException;
import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.KpiSeries;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Places observations on the sampling grid and fills short gaps by linear
 * interpolation. A gap longer than the fill limit cuts the history: only the segment
 * after the last long gap is kept, so no long stretch is ever invented.
 */
@Component
public class SeriesPreparer {

    private static final Logger log = LoggerFactory.getLogger(SeriesPreparer.class);

    private final int maxGapFill;
    private final int staleAfterSteps;

    @Autowired

    public SeriesPreparer(InsightsProperties properties) {
        this(properties.detection().maxGapFill(), properties.detection().staleAfterSteps());
    }

    SeriesPreparer(int maxGapFill, int staleAfterSteps) {
        this.maxGapFill = maxGapFill;
        this.staleAfterSteps = staleAfterSteps;
    }

    public PreparedSeries prepare(KpiSeries series, Instant asOf) {
        KpiPoint[] known = series.points().stream()
                .filter(point -> point.value() != null && Double.isFinite(point.value()))
                .toArray(KpiPoint[]::new);
        if (known.length < 2) {
            throw new DataQualityException(series.kpiName(), "fewer than two usable observations");
        }

        Duration step = series.frequency().step();
        Instant origin = known[0].timestamp();
        long stepSeconds = step.getSeconds();
        int length = (int) Math.round((double) (known[known.length - 1].timestamp().getEpochSecond()
                - origin.getEpochSecond()) / stepSeconds) + 1;
        double[] grid = new double[length];
        Arrays.fill(grid, Double.NaN);
        for (KpiPoint point : known) {
            int index = (int) Math.round((double) (point.timestamp().getEpochSecond() - origin.getEpochSecond()) / stepSeconds);
            grid[index] = point.value();
        }

        int segmentStart = 0;
        boolean truncated = false;
        boolean[] imputed = new boolean[length];
        int previousKnown = 0;
        for (int i = 1; i < length; i++) {
            if (Double.isNaN(grid[i])) {
                continue;
            }
            int gap = i - previousKnown - 1;
            if (gap > maxGapFill) {
                segmentStart = i;
                truncated = true;
                log.debug("Series preparation: {} has a {}-point gap before index {}, history truncated",
                        series.kpiName(), gap, i);
            } else if (gap > 0) {
                double from = grid[previousKnown];
                double to = grid[i];
                for (int k = 1; k <= gap; k++) {
                    grid[previousKnown + k] = from + (to - from) * k / (gap + 1);
                    imputed[previousKnown + k] = true;
                }
            }
            previousKnown = i;
        }

        if (length - segmentStart < 2) {
            throw new DataQualityException(series.kpiName(), "latest contiguous segment is shorter than two points");
        }

        double[] values = Arrays.copyOfRange(grid, segmentStart, length);
        boolean[] flags = Arrays.copyOfRange(imputed, segmentStart, length);
        Instant segmentOrigin = origin.plus(step.multipliedBy(segmentStart));
        Instant last = segmentOrigin.plus(step.multipliedBy(values.length - 1L));
        boolean stale = asOf != null && Duration.between(last, asOf).compareTo(step.multipliedBy(staleAfterSteps)) > 0;
        return new PreparedSeries(series.kpiName(), series.frequency(), segmentOrigin, values, flags, stale, truncated);
    }
}
