package com.health.anomaly.engine;

import com.health.anomaly.model.AnomalyCategory;
import com.health.anomaly.model.DeviationDirection;
import com.health.anomaly.model.MetricType;

import java.util.EnumMap;
import java.util.Map;

import static com.health.anomaly.model.DeviationDirection.ABOVE;
import static com.health.anomaly.model.DeviationDirection.BELOW;

/**
 * Lookup from (metric, direction) to the category reported to the user.
 * Independent of the numeric test that decides whether to flag at all.
 */
public final class DeviationCategoryTable {

    private static final Map<MetricType, Map<DeviationDirection, AnomalyCategory>> TABLE =
            new EnumMap<>(MetricType.class);

    static {
        put(MetricType.STEPS, AnomalyCategory.LOW_ACTIVITY, AnomalyCategory.HIGH_ACTIVITY);
        put(MetricType.DISTANCE, AnomalyCategory.LOW_ACTIVITY, AnomalyCategory.HIGH_ACTIVITY);
        put(MetricType.CALORIES, AnomalyCategory.LOW_ENERGY_EXPENDITURE, AnomalyCategory.HIGH_ENERGY_EXPENDITURE);
        put(MetricType.SCREEN_TIME, AnomalyCategory.REDUCED_SCREEN_TIME, AnomalyCategory.EXCESSIVE_SCREEN_TIME);
        put(MetricType.SLEEP, AnomalyCategory.SLEEP_DEFICIT, AnomalyCategory.EXCESSIVE_SLEEP);
        put(MetricType.HEART_RATE, AnomalyCategory.LOW_HEART_RATE, AnomalyCategory.ELEVATED_HEART_RATE);
        put(MetricType.HRV, AnomalyCategory.HIGH_STRESS, AnomalyCategory.ELEVATED_HRV);
        put(MetricType.MOOD, AnomalyCategory.LOW_MOOD, AnomalyCategory.ELEVATED_MOOD);
    }

    private DeviationCategoryTable() {}

    private static void put(MetricType metricType, AnomalyCategory below, AnomalyCategory above) {
        Map<DeviationDirection, AnomalyCategory> byDirection = new EnumMap<>(DeviationDirection.class);
        byDirection.put(BELOW, below);
        byDirection.put(ABOVE, above);
        TABLE.put(metricType, byDirection);
    }

    public static AnomalyCategory categorize(MetricType metricType, DeviationDirection direction) {
        return TABLE.get(metricType).get(direction);
    }
}
