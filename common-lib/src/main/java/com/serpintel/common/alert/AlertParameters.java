package com.serpintel.common.alert;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

/**
 * Validated alert-scan parameters.
 *
 * @param windowDays             trailing window, 1-30 days
 * @param spikeThreshold         pair-score floor for T2, 0-100
 * @param concentrationThreshold ratio floor for T3, 0-1
 * @param limit                  maximum alerts returned, 1-200
 */
public record AlertParameters(
    int windowDays,
    double spikeThreshold,
    double concentrationThreshold,
    int limit
) {
    public static final int    MAX_WINDOW_DAYS                 = 30;
    public static final double DEFAULT_SPIKE_THRESHOLD         = 75.0;
    public static final double DEFAULT_CONCENTRATION_THRESHOLD = 0.80;
    public static final int    DEFAULT_LIMIT                   = 100;
    public static final int    MAX_LIMIT                       = 200;

    public AlertParameters {
        require(windowDays >= 1 && windowDays <= MAX_WINDOW_DAYS, "windowDays",
            "windowDays must be between 1 and " + MAX_WINDOW_DAYS);
        require(spikeThreshold >= 0.0 && spikeThreshold <= 100.0, "spikeThreshold",
            "spikeThreshold must be between 0 and 100");
        require(concentrationThreshold >= 0.0 && concentrationThreshold <= 1.0, "concentrationThreshold",
            "concentrationThreshold must be between 0 and 1");
        require(limit >= 1 && limit <= MAX_LIMIT, "limit",
            "limit must be between 1 and " + MAX_LIMIT);
    }

    private static void require(boolean condition, String field, String message) {
        if (!condition) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, field, message);
        }
    }
}
