package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Tuning for the generalized ESD test used by the seasonal-ESD scorer.
 *
 * @since 1.0.0
 */
public final class SeasonalEsdOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_ALPHA = 0.05;
    public static final double DEFAULT_MAX_OUTLIER_FRACTION = 0.1;

    private static final SeasonalEsdOptions DEFAULTS =
            new SeasonalEsdOptions(DEFAULT_ALPHA, DEFAULT_MAX_OUTLIER_FRACTION);

    private final double alpha;
    private final double maxOutlierFraction;

    /**
     * @param alpha              significance level, in (0, 1)
     * @param maxOutlierFraction upper bound on the share of points the test may
     *                           remove, in (0, 0.5]
     * @throws InvalidConfigException if either value is out of range
     */
    public SeasonalEsdOptions(double alpha, double maxOutlierFraction) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new InvalidConfigException("ESD 'alpha' must be in (0, 1), got: " + alpha);
        }
        if (!(maxOutlierFraction > 0 && maxOutlierFraction <= 0.5)) {
            throw new InvalidConfigException(
                    "ESD 'maxOutlierFraction' must be in (0, 0.5], got: " + maxOutlierFraction);
        }
        this.alpha = alpha;
        this.maxOutlierFraction = maxOutlierFraction;
    }

    public static SeasonalEsdOptions defaults() {
        return DEFAULTS;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getMaxOutlierFraction() {
        return maxOutlierFraction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalEsdOptions that))
            return false;
        return Double.compare(alpha, that.alpha) == 0
                && Double.compare(maxOutlierFraction, that.maxOutlierFraction) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, maxOutlierFraction);
    }

    @Override
    public String toString() {
        return "SeasonalEsdOptions{alpha=" + alpha + ", maxOutlierFraction=" + maxOutlierFraction + '}';
    }
}
