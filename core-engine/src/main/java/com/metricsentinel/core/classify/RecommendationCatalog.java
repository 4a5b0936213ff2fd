package com.metricsentinel.core.classify;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static remediation hints keyed by metric family and direction.
 *
 * <p>
 * Every entry holds at most three hints, most actionable first.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecommendationCatalog {

    public static final int MAX_RECOMMENDATIONS = 3;

    private static final Map<MetricType, Map<Direction, List<String>>> CATALOG = new EnumMap<>(MetricType.class);

    static {
        register(MetricType.CPU,
                List.of("Check for runaway processes or hot loops",
                        "Consider scaling out or raising CPU limits",
                        "Review recent deployments for performance regressions"),
                List.of("Verify the service is still receiving traffic",
                        "Check for stalled workers or blocked threads"));
        register(MetricType.MEMORY,
                List.of("Inspect heap usage for a memory leak",
                        "Review garbage collection pauses",
                        "Consider raising memory limits"),
                List.of("Verify the process has not restarted unexpectedly",
                        "Check whether caches were evicted"));
        register(MetricType.DISK,
                List.of("Free space or extend the volume",
                        "Check log rotation and retention",
                        "Look for I/O-heavy batch jobs"),
                List.of("Verify writes are still reaching the volume",
                        "Check for a stalled ingestion pipeline"));
        register(MetricType.NETWORK,
                List.of("Check for traffic spikes or abusive clients",
                        "Review load balancer distribution",
                        "Consider raising bandwidth limits"),
                List.of("Check upstream connectivity",
                        "Verify health checks and service discovery"));
        register(MetricType.LATENCY,
                List.of("Check downstream dependencies for slow responses",
                        "Review database query performance",
                        "Consider scaling the service tier"),
                List.of("Verify requests are not short-circuiting on errors"));
        register(MetricType.ERROR_RATE,
                List.of("Inspect application logs for new exceptions",
                        "Review recent deployments and consider a rollback",
                        "Check dependency health"),
                List.of("Verify error reporting is still wired up"));
        register(MetricType.OTHER,
                List.of("Review recent system changes",
                        "Monitor for pattern continuation"),
                List.of("Verify the metric source is healthy",
                        "Monitor for pattern continuation"));
    }

    private RecommendationCatalog() {
        // static utility
    }

    private static void register(MetricType type, List<String> above, List<String> below) {
        Map<Direction, List<String>> byDirection = new EnumMap<>(Direction.class);
        byDirection.put(Direction.ABOVE, List.copyOf(above));
        byDirection.put(Direction.BELOW, List.copyOf(below));
        CATALOG.put(type, byDirection);
    }

    public static List<String> lookup(MetricType type, Direction direction) {
        List<String> hints = CATALOG.getOrDefault(type, CATALOG.get(MetricType.OTHER)).get(direction);
        return hints.size() > MAX_RECOMMENDATIONS ? hints.subList(0, MAX_RECOMMENDATIONS) : hints;
    }

    public static List<String> forMetric(String metricName, double value, double expected) {
        return lookup(MetricType.resolve(metricName), Direction.of(value, expected));
    }
}
