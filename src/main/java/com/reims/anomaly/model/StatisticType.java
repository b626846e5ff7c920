package com.reims.anomaly.model;

/**
 * Which statistic an {@link AnomalyCandidate#getStatistic()} value carries.
 */
public enum StatisticType {
    Z_SCORE,
    CUSUM_STAT,
    PCT_CHANGE,
    VOLATILITY_RATIO,
    MODEL_SCORE
}
