package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive context attached to an {@link Anomaly} for display purposes.
 *
 * @since 1.0.0
 */
public final class AnomalyContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final boolean seasonality;
    private final Trend trend;
    private final List<String> relatedMetrics;
    private final String businessContext;
    private final String historicalPattern;

    public AnomalyContext(String metric, boolean seasonality, Trend trend,
            List<String> relatedMetrics, String businessContext, String historicalPattern) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.seasonality = seasonality;
        this.trend = Objects.requireNonNull(trend, "trend must not be null");
        this.relatedMetrics = relatedMetrics != null ? List.copyOf(relatedMetrics) : List.of();
        this.businessContext = businessContext;
        this.historicalPattern = historicalPattern;
    }

    public String getMetric() {
        return metric;
    }

    public boolean isSeasonality() {
        return seasonality;
    }

    public Trend getTrend() {
        return trend;
    }

    public List<String> getRelatedMetrics() {
        return relatedMetrics;
    }

    public String getBusinessContext() {
        return businessContext;
    }

    public String getHistoricalPattern() {
        return historicalPattern;
    }

    @Override
    public String toString() {
        return "AnomalyContext{" +
                "metric='" + metric + '\'' +
                ", trend=" + trend +
                ", pattern='" + historicalPattern + '\'' +
                '}';
    }
}
