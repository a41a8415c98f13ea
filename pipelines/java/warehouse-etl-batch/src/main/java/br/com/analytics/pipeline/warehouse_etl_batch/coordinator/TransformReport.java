package br.com.analytics.pipeline.warehouse_etl_batch.coordinator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a run over every entity. Failed entities count zero rows and keep their cause.
 */
public record TransformReport(Map<String, Integer> rowCounts, Map<String, Throwable> failures) {

    public TransformReport {
        rowCounts = Collections.unmodifiableMap(new LinkedHashMap<>(rowCounts));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int totalRows() {
        return rowCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int succeeded() {
        return rowCounts.size() - failures.size();
    }
}
