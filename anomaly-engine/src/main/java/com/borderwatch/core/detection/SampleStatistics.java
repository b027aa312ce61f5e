package com.borderwatch.core.detection;

/**
 * Mean and sample standard deviation over the finite entries of an array.
 */
final class SampleStatistics {

    /** Minimum number of values required for a standard deviation. */
    static final int MIN_SAMPLE_SIZE = 2;

    private final int count;
    private final double mean;
    private final double stdDev;

    private SampleStatistics(int count, double mean, double stdDev) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
    }

    /**
     * @param values sample; non-finite entries are ignored
     * @return the statistics of the finite entries
     */
    static SampleStatistics of(double[] values) {
        int count = 0;
        double sum = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v;
                count++;
            }
        }
        if (count == 0) {
            return new SampleStatistics(0, Double.NaN, Double.NaN);
        }
        double mean = sum / count;
        if (count < MIN_SAMPLE_SIZE) {
            return new SampleStatistics(count, mean, Double.NaN);
        }

        double sumSquaredDiff = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                double diff = v - mean;
                sumSquaredDiff += diff * diff;
            }
        }
        return new SampleStatistics(count, mean, Math.sqrt(sumSquaredDiff / (count - 1)));
    }

    int getCount() {
        return count;
    }

    double getMean() {
        return mean;
    }

    double getStdDev() {
        return stdDev;
    }

    boolean hasEnoughData() {
        return count >= MIN_SAMPLE_SIZE;
    }

    /**
     * @return {@code true} if the spread is zero or undefined, so z-scores
     *         cannot be computed
     */
    boolean isDegenerate() {
        return !Double.isFinite(stdDev) || stdDev == 0;
    }

    double zScore(double value) {
        return (value - mean) / stdDev;
    }
}
