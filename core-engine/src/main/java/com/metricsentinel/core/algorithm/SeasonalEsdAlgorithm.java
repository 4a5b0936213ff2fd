package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.SeasonalEsdOptions;
import com.metricsentinel.core.model.Algorithm;
import com.metricsentinel.core.model.Sample;
import com.metricsentinel.core.window.ScoringWindow;
import com.metricsentinel.core.window.SeasonalProfile;
import com.metricsentinel.core.window.Stats;
import org.apache.commons.math3.distribution.TDistribution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Seasonal hybrid ESD.
 *
 * <p>
 * With contextual detection enabled and enough hour-of-day history, values are
 * first reduced to residuals against their cohort baseline; otherwise the raw
 * values are tested. Rosner's generalized ESD test then runs over the window
 * plus the candidate with at most {@code ceil(maxOutlierFraction · n)}
 * removals. The candidate is anomalous only when the test marks it as an
 * outlier <em>and</em> its studentized deviate against the window residuals
 * exceeds the configured threshold; the deviate is the reported score.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalEsdAlgorithm extends WindowAlgorithm {

    private final SeasonalEsdOptions options;

    public SeasonalEsdAlgorithm(SeasonalEsdOptions options) {
        this.options = Objects.requireNonNull(options, "SeasonalEsdOptions must not be null");
    }

    @Override
    public Algorithm id() {
        return Algorithm.SEASONAL_ESD;
    }

    @Override
    protected ScoreResult evaluate(ScoringWindow window, Sample candidate, DetectionConfig config) {
        List<Sample> samples = window.samples();
        SeasonalProfile profile = config.isEnableContextual() ? SeasonalProfile.of(samples) : null;
        boolean seasonal = profile != null && profile.isUsable();

        int n = samples.size() + 1;
        double[] residuals = new double[n];
        for (int i = 0; i < samples.size(); i++) {
            Sample s = samples.get(i);
            residuals[i] = seasonal ? s.getValue() - profile.offsetFor(s.getTimestamp()) : s.getValue();
        }
        double candidateOffset = seasonal ? profile.offsetFor(candidate.getTimestamp()) : 0.0;
        residuals[n - 1] = candidate.getValue() - candidateOffset;

        double[] windowResiduals = new double[n - 1];
        System.arraycopy(residuals, 0, windowResiduals, 0, n - 1);
        double mean = Stats.mean(windowResiduals);
        double stdDev = Stats.stdDev(windowResiduals, mean);
        double expected = mean + candidateOffset;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("seasonal", seasonal);

        double score = Stats.isDegenerate(stdDev, mean) ? 0.0 : Math.abs(residuals[n - 1] - mean) / stdDev;
        boolean candidateIsOutlier = isEsdOutlier(residuals, n - 1, details);
        details.put("candidateIsOutlier", candidateIsOutlier);

        ScoreResult result = ScoreResult.of(score, candidateIsOutlier && score > config.getThreshold(), expected)
                .withDetails(details);
        return seasonal && candidateOffset != 0.0 ? result.asContextual() : result;
    }

    // ---------------------------------------------------------------
    // Generalized ESD
    // ---------------------------------------------------------------

    /**
     * Run the test over {@code data} and report whether {@code target} is among
     * the outliers, i.e. it was removed at a step {@code j <= k} where
     * {@code k} is the largest step with {@code R_k > λ_k}.
     */
    private boolean isEsdOutlier(double[] data, int target, Map<String, Object> details) {
        int n = data.length;
        int maxOutliers = Math.min((int) Math.ceil(options.getMaxOutlierFraction() * n), n - 2);

        List<Integer> remaining = indices(n);
        int outliers = 0;
        int targetRank = Integer.MAX_VALUE;
        for (int i = 1; i <= maxOutliers; i++) {
            double mean = 0;
            for (int idx : remaining) {
                mean += data[idx];
            }
            mean /= remaining.size();
            double sumSq = 0;
            for (int idx : remaining) {
                double d = data[idx] - mean;
                sumSq += d * d;
            }
            double sd = Math.sqrt(sumSq / (remaining.size() - 1));
            if (Stats.isDegenerate(sd, mean)) {
                break;
            }

            int worst = mostExtreme(data, remaining, mean);
            double r = Math.abs(data[remaining.get(worst)] - mean) / sd;
            double lambda = criticalValue(n, i);
            if (remaining.get(worst) == target) {
                targetRank = i;
                details.put("criticalValue", lambda);
            }
            if (r > lambda) {
                outliers = i;
            }
            remaining.remove(worst);
        }
        details.put("esdOutliers", outliers);
        return targetRank <= outliers;
    }

    /** Rosner's λ_i for sample size {@code n}. */
    double criticalValue(int n, int i) {
        double p = 1.0 - options.getAlpha() / (2.0 * (n - i + 1));
        double t = new TDistribution(n - i - 1).inverseCumulativeProbability(p);
        return (n - i) * t / Math.sqrt((n - i - 1 + t * t) * (n - i + 1));
    }

    private static int mostExtreme(double[] data, List<Integer> remaining, double mean) {
        int worst = 0;
        double worstDev = -1;
        for (int k = 0; k < remaining.size(); k++) {
            double dev = Math.abs(data[remaining.get(k)] - mean);
            if (dev > worstDev) {
                worstDev = dev;
                worst = k;
            }
        }
        return worst;
    }

    private static List<Integer> indices(int n) {
        List<Integer> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(i);
        }
        return out;
    }
}
