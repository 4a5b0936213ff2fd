package com.metricsentinel.core.algorithm;

import com.metricsentinel.core.config.DetectionConfig;
import com.metricsentinel.core.config.EnsembleOptions;
import com.metricsentinel.core.model.Algorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link DetectionAlgorithm} instances from a
 * {@link DetectionConfig}.
 *
 * <p>
 * This is the single point of extension when adding new algorithms: register
 * the new identifier here and create the corresponding scorer. Each scorer
 * receives only its own option object. With contextual detection enabled,
 * single algorithms are wrapped in a {@link ContextualAlgorithm}; seasonal-ESD
 * handles seasonality itself and the ensemble wraps its members individually.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlgorithmFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlgorithmFactory.class);

    private AlgorithmFactory() {
        // static utility
    }

    /**
     * Create the scorer selected by {@code config.getAlgorithm()}.
     *
     * @param config detection configuration; must not be {@code null}
     * @return a ready-to-use scorer
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public static DetectionAlgorithm create(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        return create(config.getAlgorithm(), config);
    }

    /**
     * Create the scorer for {@code algorithm}, taking its options from
     * {@code config}.
     */
    public static DetectionAlgorithm create(Algorithm algorithm, DetectionConfig config) {
        Objects.requireNonNull(algorithm, "Algorithm must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        if (algorithm == Algorithm.ENSEMBLE) {
            EnsembleOptions options = config.getEnsemble();
            List<DetectionAlgorithm> members = options.getMembers().stream()
                    .map(m -> create(m, config))
                    .toList();
            LOG.debug("Creating ensemble over {} (tie-break {})", options.getMembers(), options.getTieBreak());
            return new EnsembleCoordinator(members, options.getTieBreak());
        }

        DetectionAlgorithm base = switch (algorithm) {
            case ZSCORE -> new ZScoreAlgorithm();
            case MODIFIED_ZSCORE -> new ModifiedZScoreAlgorithm();
            case IQR -> new IqrAlgorithm();
            case ISOLATION_FOREST -> new IsolationForestAlgorithm(config.getIsolationForest());
            case SEASONAL_ESD -> new SeasonalEsdAlgorithm(config.getSeasonalEsd());
            default -> throw new IllegalArgumentException("Unsupported algorithm: '" + algorithm.id() + "'");
        };

        if (config.isEnableContextual() && algorithm != Algorithm.SEASONAL_ESD) {
            return new ContextualAlgorithm(base);
        }
        return base;
    }

    /**
     * Create a scorer from an algorithm identifier such as
     * {@code "modified_zscore"}.
     *
     * @throws com.metricsentinel.core.config.InvalidConfigException if the
     *                                                                identifier
     *                                                                is unknown
     */
    public static DetectionAlgorithm create(String algorithmId, DetectionConfig config) {
        return create(Algorithm.fromId(algorithmId), config);
    }
}
