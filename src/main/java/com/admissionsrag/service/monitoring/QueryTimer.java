package com.admissionsrag.service.monitoring;

import com.admissionsrag.dto.internal.TimingInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-request stopwatch. Each {@link #mark(String)} records the time spent
 * since the previous mark.
 */
public class QueryTimer {

    private Long startTime;

    private Long endTime;

    private final Map<String, Long> timings = new LinkedHashMap<>();

    public void start() {
        this.startTime = System.currentTimeMillis();
        this.timings.clear();
        this.endTime = null;
    }

    public void mark(String stepName) {
        if (startTime == null) {
            start();
        }
        // repeated steps (one per agent turn) accumulate under one name
        timings.merge(stepName, System.currentTimeMillis() - startTime - elapsedMarked(), Long::sum);
    }

    public void end() {
        this.endTime = System.currentTimeMillis();
    }

    public double getTotalTime() {
        if (startTime == null || endTime == null) {
            return 0.0;
        }
        return (endTime - startTime) / 1000.0;
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();
        timings.forEach((step, millis) -> durations.put(step, millis / 1000.0));
        return durations;
    }

    public TimingInfo toTimingInfo() {
        return TimingInfo.builder()
                .totalTime(getTotalTime())
                .stepDurations(getStepDurations())
                .timestamp(Instant.now().toString())
                .build();
    }

    public String formatDisplay() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Processing time: %.2fs", getTotalTime()));
        for (Map.Entry<String, Double> entry : getStepDurations().entrySet()) {
            sb.append(String.format("%n  - %s: %.2fs", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }

    private long elapsedMarked() {
        return timings.values().stream().mapToLong(Long::longValue).sum();
    }
}
