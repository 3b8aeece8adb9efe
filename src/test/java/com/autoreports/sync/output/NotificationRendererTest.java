package com.autoreports.sync.output;

import com.autoreports.core.IssueSeverity;
import com.autoreports.core.RunSummary;
import com.autoreports.sync.archive.ArchiveMove;
import com.autoreports.sync.archive.ArchiveReport;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationRendererTest {
    private final NotificationRenderer renderer = new NotificationRenderer(ZoneId.of("Europe/Moscow"));

    @Test
    void errorReportListsIssuesAndEscapesMessages() {
        RunSummary summary = new RunSummary("INSERT", "insert", Instant.parse("2026-10-19T05:00:00Z"));
        summary.recordIssue(IssueSeverity.ERROR, "REQ000000000007", "insert failed: value <too long>");
        summary.markAborted();
        summary.finish();

        String html = renderer.renderErrorReport(summary);

        assertTrue(html.contains("INSERT"));
        assertTrue(html.contains("2026-10-19 08:00:00"));
        assertTrue(html.contains("REQ000000000007"));
        assertTrue(html.contains("value &lt;too long&gt;"));
        assertTrue(html.contains("The run was aborted."));
    }

    @Test
    void archiveReportGroupsByParentFolder() {
        ArchiveReport report = new ArchiveReport();
        Path sales = Path.of("/reports/sales");
        report.add(new ArchiveMove("REQ000000000001", sales.resolve("REQ000000000001"),
                sales.resolve("Archive").resolve("REQ000000000001"), false));
        report.add(new ArchiveMove("RA0000000000002", sales.resolve("RA0000000000002"),
                sales.resolve("Archive").resolve("RA0000000000002"), true));

        String html = renderer.renderArchiveReport(report);

        assertTrue(html.contains(sales.toString()));
        assertTrue(html.contains("REQ000000000001"));
        assertTrue(html.contains("RA0000000000002"));
        assertTrue(html.contains("yes"));
    }
}
