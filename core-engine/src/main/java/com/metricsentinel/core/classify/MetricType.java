package com.metricsentinel.core.classify;

import java.util.List;
import java.util.Locale;

/**
 * Coarse metric family, inferred from the metric name.
 *
 * <p>
 * Resolution is substring based and ordered: {@code api_error_rate} is an
 * error rate and {@code disk_io_latency} a latency, because those families are
 * checked before the resource families.
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricType {
    ERROR_RATE(List.of("error", "fail", "5xx"),
            List.of("latency", "cpu", "memory"),
            "Service reliability and user-facing failures"),
    LATENCY(List.of("latency", "response_time", "duration", "p99", "p95"),
            List.of("cpu", "network", "error_rate"),
            "User-facing responsiveness"),
    CPU(List.of("cpu"),
            List.of("memory", "disk_io", "network"),
            "Application performance impact"),
    MEMORY(List.of("memory", "mem_", "heap", "rss"),
            List.of("cpu", "gc_time", "heap_usage"),
            "Memory leak or capacity issues"),
    DISK(List.of("disk", "storage", "iops", "volume"),
            List.of("cpu", "memory", "disk_io"),
            "Storage capacity or I/O performance"),
    NETWORK(List.of("network", "bandwidth", "throughput", "packet", "net_"),
            List.of("cpu", "bandwidth", "latency"),
            "Connectivity or bandwidth issues"),
    OTHER(List.of(), List.of(), "General system metric");

    private final List<String> markers;
    private final List<String> relatedMetrics;
    private final String businessContext;

    MetricType(List<String> markers, List<String> relatedMetrics, String businessContext) {
        this.markers = markers;
        this.relatedMetrics = relatedMetrics;
        this.businessContext = businessContext;
    }

    public List<String> relatedMetrics() {
        return relatedMetrics;
    }

    public String businessContext() {
        return businessContext;
    }

    public static MetricType resolve(String metricName) {
        if (metricName == null) {
            return OTHER;
        }
        String name = metricName.toLowerCase(Locale.ROOT);
        for (MetricType type : values()) {
            for (String marker : type.markers) {
                if (name.contains(marker)) {
                    return type;
                }
            }
        }
        return OTHER;
    }
}
