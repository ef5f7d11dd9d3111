package com.health.anomaly.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a baseline computation: either a {@link UserBaseline} or
 * "insufficient data", which means "keep collecting" and is not an error.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BaselineComputation {

    String userId;
    int sampleCount;
    UserBaseline baseline;

    public static BaselineComputation computed(UserBaseline baseline) {
        return new BaselineComputation(baseline.getUserId(), baseline.getSampleCount(), baseline);
    }

    public static BaselineComputation insufficient(String userId, int sampleCount) {
        return new BaselineComputation(userId, sampleCount, null);
    }

    public boolean isInsufficientData() {
        return baseline == null;
    }

    public Optional<UserBaseline> asBaseline() {
        return Optional.ofNullable(baseline);
    }
}
