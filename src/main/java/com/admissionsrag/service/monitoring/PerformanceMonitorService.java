package com.admissionsrag.service.monitoring;

import com.admissionsrag.config.AdmissionsRagProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps the most recent query timings and summarizes them per pipeline step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private final AdmissionsRagProperties properties;

    private final Deque<QueryRecord> queryHistory = new ConcurrentLinkedDeque<>();

    public void record(String query, String mode, String outcome, QueryTimer timer) {
        if (!Boolean.TRUE.equals(properties.getMonitoring().getEnabled())) {
            return;
        }

        queryHistory.addLast(new QueryRecord(
                Instant.now().toString(),
                query.length() > 100 ? query.substring(0, 100) + "..." : query,
                mode,
                outcome,
                timer.getTotalTime(),
                timer.getStepDurations()));

        // Keep only recent N queries
        while (queryHistory.size() > properties.getMonitoring().getMaxQueryHistory()) {
            queryHistory.pollFirst();
        }
    }

    public List<QueryRecord> getQueryHistory() {
        return List.copyOf(queryHistory);
    }

    public Map<String, Object> getStatistics() {
        List<QueryRecord> records = getQueryHistory();
        if (records.isEmpty()) {
            return Map.of("message", "No queries recorded yet");
        }

        List<Double> totalTimes = records.stream().map(QueryRecord::totalTime).toList();

        Map<String, List<Double>> allSteps = new LinkedHashMap<>();
        Map<String, Long> byMode = new TreeMap<>();
        Map<String, Long> byOutcome = new TreeMap<>();
        for (QueryRecord record : records) {
            record.stepDurations().forEach((step, duration) ->
                    allSteps.computeIfAbsent(step, k -> new ArrayList<>()).add(duration));
            byMode.merge(record.mode(), 1L, Long::sum);
            byOutcome.merge(record.outcome(), 1L, Long::sum);
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalQueries", records.size());
        stats.put("queriesByMode", byMode);
        stats.put("queriesByOutcome", byOutcome);
        stats.put("avgTotalTime", average(totalTimes));
        stats.put("medianTotalTime", median(totalTimes));
        stats.put("minTotalTime", Collections.min(totalTimes));
        stats.put("maxTotalTime", Collections.max(totalTimes));

        Map<String, Map<String, Double>> stepStats = new LinkedHashMap<>();
        allSteps.forEach((step, times) -> {
            Map<String, Double> stepStat = new LinkedHashMap<>();
            stepStat.put("avg", average(times));
            stepStat.put("median", median(times));
            stepStat.put("max", Collections.max(times));
            stepStats.put(step, stepStat);
        });
        stats.put("stepStatistics", stepStats);

        return stats;
    }

    static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size % 2 == 0) {
            return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        }
        return sorted.get(size / 2);
    }

    public record QueryRecord(
            String timestamp,
            String query,
            String mode,
            String outcome,
            Double totalTime,
            Map<String, Double> stepDurations) {
    }
}
