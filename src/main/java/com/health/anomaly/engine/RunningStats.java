package com.health.anomaly.engine;

/**
 * Welford accumulator for mean and population variance of one metric.
 */
class RunningStats {

    private long count;
    private double mean;
    private double m2;

    void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    double getMean() {
        return mean;
    }

    double getPopulationStdDev() {
        if (count == 0) return 0.0;
        return Math.sqrt(Math.max(0.0, m2 / count));
    }
}
