package com.autoreports.app;

import com.autoreports.core.IssueSeverity;
import com.autoreports.core.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoReportsApplicationTest {

    @TempDir
    Path workDir;

    @Test
    void tasksAcceptCommasAndWhitespace() {
        assertEquals(List.of("daily_update", "REQ000000000001", "insert"),
                List.copyOf(AutoReportsApplication.parseTasks(" daily_update, REQ000000000001  insert,,daily_update ")));
    }

    @Test
    void blankTasksMeanNothingRequested() {
        assertTrue(AutoReportsApplication.parseTasks(null).isEmpty());
        assertTrue(AutoReportsApplication.parseTasks("  ").isEmpty());
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(0, new AutoReportsApplication().run(new String[]{"--help"}));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(2, new AutoReportsApplication().run(new String[]{"--bogus"}));
    }

    @Test
    void stoppedRunIsCriticalAndAborted() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T05:00:00Z"), ZoneOffset.UTC);

        RunSummary insert = AutoReportsApplication.stoppedRun(Set.of("REQ000000000001"),
                new IllegalStateException("registry unavailable"), clock);
        RunSummary update = AutoReportsApplication.stoppedRun(Set.of(), new NullPointerException(), clock);

        assertEquals("INSERT", insert.operation());
        assertEquals(1, insert.issueCount(IssueSeverity.CRITICAL));
        assertEquals("run stopped: registry unavailable", insert.issues().get(0).message());
        assertTrue(insert.aborted());
        assertTrue(insert.requiresNotification());
        assertEquals("UPDATE", update.operation());
        assertEquals("run stopped: NullPointerException", update.issues().get(0).message());
    }

    @Test
    void startupFailureSendsErrorMail() throws IOException {
        Files.writeString(workDir.resolve("config.properties"), String.join("\n",
                "db.url=jdbc:mysql://nowhere/registry",
                "mail.enabled=true",
                "mail.dry-run=true",
                "mail.to=ops@corp.local",
                ""), StandardCharsets.UTF_8);

        int exit = new AutoReportsApplication().execute(Set.of(), workDir);

        assertEquals(1, exit);
        List<Path> written;
        try (Stream<Path> files = Files.list(workDir.resolve("outputs").resolve("mail_dry_run"))) {
            written = files.collect(Collectors.toList());
        }
        assertEquals(1, written.size());
        String eml = Files.readString(written.get(0), StandardCharsets.UTF_8);
        assertTrue(eml.contains("update errors"), eml);
        assertTrue(eml.contains("(0 error, 1 critical)"), eml);
        assertTrue(eml.contains("To: ops@corp.local"), eml);
    }
}
