package com.cgi.fielddiscovery.classifier.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Instrumentation service collecting counters of the classification pipeline
 * and of the discovery runs that drive it.
 */
@Component
public class ClassificationMetricsCollector {
    // Classification outcomes
    private final AtomicInteger aiClassificationCount = new AtomicInteger(0);
    private final AtomicInteger fallbackClassificationCount = new AtomicInteger(0);
    private final AtomicInteger aiFailureCount = new AtomicInteger(0);

    // Result cache
    private final AtomicInteger cacheHitCount = new AtomicInteger(0);
    private final AtomicInteger cacheMissCount = new AtomicInteger(0);
    private final AtomicInteger cacheErrorCount = new AtomicInteger(0);

    // Tables
    private final AtomicInteger tablesProcessedCount = new AtomicInteger(0);
    private final AtomicInteger tablesFailedCount = new AtomicInteger(0);
    private final AtomicLong tableProcessingTimeMs = new AtomicLong(0);

    public void recordAiClassification() {
        aiClassificationCount.incrementAndGet();
    }

    public void recordFallbackClassification() {
        fallbackClassificationCount.incrementAndGet();
    }

    public void recordAiFailure() {
        aiFailureCount.incrementAndGet();
    }

    public void recordCacheHit() {
        cacheHitCount.incrementAndGet();
    }

    public void recordCacheMiss() {
        cacheMissCount.incrementAndGet();
    }

    public void recordCacheError() {
        cacheErrorCount.incrementAndGet();
    }

    /**
     * Records a processed table with its processing time.
     *
     * @param timeMs Processing time in ms
     */
    public void recordTableProcessed(long timeMs) {
        tablesProcessedCount.incrementAndGet();
        tableProcessingTimeMs.addAndGet(timeMs);
    }

    public void recordTableFailed() {
        tablesFailedCount.incrementAndGet();
    }


    /**
     * Generates a report of collected metrics.
     *
     * @return Map containing all metrics
     */
    public Map<String, Object> getMetricsReport() {
        Map<String, Object> report = new LinkedHashMap<>();

        report.put("aiClassifications", aiClassificationCount.get());
        report.put("fallbackClassifications", fallbackClassificationCount.get());
        report.put("aiFailures", aiFailureCount.get());

        report.put("cacheHits", cacheHitCount.get());
        report.put("cacheMisses", cacheMissCount.get());
        report.put("cacheErrors", cacheErrorCount.get());
        int lookups = cacheHitCount.get() + cacheMissCount.get();
        report.put("cacheHitRatio", lookups > 0 ? (double) cacheHitCount.get() / lookups : 0.0);

        int processed = tablesProcessedCount.get();
        report.put("tablesProcessed", processed);
        report.put("tablesFailed", tablesFailedCount.get());
        report.put("totalTableProcessingTimeMs", tableProcessingTimeMs.get());
        report.put("averageTableProcessingTimeMs", processed > 0 ? (double) tableProcessingTimeMs.get() / processed : 0.0);

        return report;
    }
}
