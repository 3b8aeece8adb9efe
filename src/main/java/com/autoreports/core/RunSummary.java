package com.autoreports.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Captures a single reconciliation run: per-step statistics, write counters and every issue by severity.
 * Returned by the runner and inspected by the caller to decide on the end-of-run notification.
 */
public final class RunSummary {
    public static final String STEP_DISCOVER = "DISCOVER";
    public static final String STEP_STORE_FETCH = "STORE_FETCH";
    public static final String STEP_EXTRACT = "EXTRACT";
    public static final String STEP_MERGE = "MERGE";
    public static final String STEP_PERSIST = "PERSIST";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String operation;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private int targets;
    private int inserted;
    private int updated;
    private int unchanged;
    private int failedWrites;
    private boolean aborted;

    private final Map<IssueSeverity, Integer> issueCounts = new EnumMap<>(IssueSeverity.class);
    private final List<Issue> issues = new ArrayList<>();
    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunSummary(String operation, String trigger, Instant startedAt) {
        this.operation = blankTo(operation, "UPDATE");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        for (IssueSeverity severity : IssueSeverity.values()) {
            issueCounts.put(severity, 0);
        }
    }

    public synchronized String operation() {
        return operation;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
    }

    public synchronized void recordIssue(IssueSeverity severity, String identifier, String message) {
        IssueSeverity level = severity == null ? IssueSeverity.ERROR : severity;
        issueCounts.merge(level, 1, Integer::sum);
        issues.add(new Issue(level, blankTo(identifier, "-"), message == null ? "" : message.trim(), Instant.now()));
    }

    public synchronized void setTargets(int targets) {
        this.targets = Math.max(0, targets);
    }

    public synchronized void addWrites(int inserted, int updated, int unchanged, int failed) {
        this.inserted += Math.max(0, inserted);
        this.updated += Math.max(0, updated);
        this.unchanged += Math.max(0, unchanged);
        this.failedWrites += Math.max(0, failed);
    }

    public synchronized void markAborted() {
        this.aborted = true;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized boolean aborted() {
        return aborted;
    }

    public synchronized int targets() {
        return targets;
    }

    public synchronized int inserted() {
        return inserted;
    }

    public synchronized int updated() {
        return updated;
    }

    public synchronized int unchanged() {
        return unchanged;
    }

    public synchronized int failedWrites() {
        return failedWrites;
    }

    public synchronized int issueCount(IssueSeverity severity) {
        return issueCounts.getOrDefault(severity, 0);
    }

    public synchronized List<Issue> issues() {
        return List.copyOf(issues);
    }

    public synchronized Set<IssueSeverity> severitiesSeen() {
        Set<IssueSeverity> out = EnumSet.noneOf(IssueSeverity.class);
        for (Map.Entry<IssueSeverity, Integer> entry : issueCounts.entrySet()) {
            if (entry.getValue() > 0) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    /**
     * True when at least one ERROR or CRITICAL issue was recorded.
     */
    public synchronized boolean requiresNotification() {
        for (IssueSeverity severity : severitiesSeen()) {
            if (severity.notifies()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wall-clock time from start to {@link #finish()}, or to now while the run is still going.
     */
    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("operation=").append(operation).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(totalElapsedMs()).append('\n');
        sb.append("aborted=").append(aborted).append('\n');
        sb.append("targets=").append(targets).append('\n');
        sb.append(String.format(Locale.US, "writes inserted=%d updated=%d unchanged=%d failed=%d",
                inserted, updated, unchanged, failedWrites)).append('\n');
        sb.append(String.format(Locale.US, "issues warning=%d error=%d critical=%d",
                issueCounts.get(IssueSeverity.WARNING),
                issueCounts.get(IssueSeverity.ERROR),
                issueCounts.get(IssueSeverity.CRITICAL))).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut
            )).append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record Issue(IssueSeverity severity, String identifier, String message, Instant at) {
    }
}
