package com.autoreports.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunSummaryTest {

    @Test
    void summaryShouldContainCountersAndSteps() {
        RunSummary summary = new RunSummary("UPDATE", "daily_update", Instant.parse("2026-10-19T05:00:00Z"));
        summary.startStep(RunSummary.STEP_DISCOVER);
        summary.endStep(RunSummary.STEP_DISCOVER, 0, 12);
        summary.setTargets(12);
        summary.addWrites(0, 3, 9, 0);
        summary.recordIssue(IssueSeverity.WARNING, "REQ000000000001", "no scheduled task registered");
        summary.finish();

        String text = summary.getSummary();

        assertTrue(text.contains("operation=UPDATE"));
        assertTrue(text.contains("trigger=daily_update"));
        assertTrue(text.contains("writes inserted=0 updated=3 unchanged=9 failed=0"));
        assertTrue(text.contains("issues warning=1 error=0 critical=0"));
        assertTrue(text.contains("steps:"));
        assertTrue(text.contains(RunSummary.STEP_DISCOVER + " elapsed_ms="));
    }

    @Test
    void onlyErrorsAndCriticalsRequireNotification() {
        RunSummary summary = new RunSummary("INSERT", "insert", Instant.now());
        summary.recordIssue(IssueSeverity.WARNING, "REQ000000000001", "trigger skipped");
        assertFalse(summary.requiresNotification());

        summary.recordIssue(null, " ", "insert failed");
        assertTrue(summary.requiresNotification());
        assertEquals(1, summary.issueCount(IssueSeverity.ERROR));
        assertEquals("-", summary.issues().get(1).identifier());
    }

    @Test
    void repeatedStepsAccumulate() {
        RunSummary summary = new RunSummary(null, null, null);
        summary.startStep("store_fetch");
        summary.endStep(RunSummary.STEP_STORE_FETCH, 4, 4);
        summary.startStep(RunSummary.STEP_STORE_FETCH);
        summary.endStep(RunSummary.STEP_STORE_FETCH, 2, -1);

        String text = summary.getSummary();

        assertTrue(text.contains("operation=UPDATE"));
        assertTrue(text.contains("trigger=manual"));
        assertTrue(text.contains("in=6 out=4"));
    }

    @Test
    void elapsedTimeIsClampedAndReportedInSummary() {
        RunSummary future = new RunSummary("INSERT", "insert", Instant.now().plusSeconds(3600));
        future.finish();
        assertEquals(0L, future.totalElapsedMs());

        RunSummary past = new RunSummary("UPDATE", "daily_update", Instant.now().minusSeconds(120));
        past.finish();
        long elapsed = past.totalElapsedMs();

        assertTrue(elapsed >= 120_000L);
        assertEquals(elapsed, past.totalElapsedMs());
        assertTrue(past.getSummary().contains("total_elapsed_ms=" + elapsed));
    }
}
