package com.barthel.regcalc.domain.calc;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Statistics over Monte-Carlo samples. Quantiles use linear interpolation
 * between order statistics (Hyndman-Fan type 7).
 */
public final class SampleStatistics {

    private SampleStatistics() {
    }

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    /**
     * Population standard deviation (divisor n).
     */
    public static double populationStandardDeviation(double[] values) {
        return Math.sqrt(StatUtils.populationVariance(values));
    }

    /**
     * @param level quantile level in (0, 1]
     */
    public static double quantile(double[] values, double level) {
        return new Percentile()
                .withEstimationType(EstimationType.R_7)
                .evaluate(values, level * 100.0);
    }

    /**
     * Index of the first order statistic in the upper tail at {@code level}:
     * {@code floor(n * level)}, kept inside the sample.
     */
    public static int tailStart(int sampleSize, double level) {
        int start = (int) Math.floor(sampleSize * level);
        return Math.min(Math.max(start, 0), sampleSize - 1);
    }

    public static double[] sorted(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }
}
