package com.autoreports.sync.archive;

import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import com.autoreports.sync.model.TaskRuntimeInfo;
import com.autoreports.sync.model.TaskState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveMoverTest {
    private final ArchiveMover mover = new ArchiveMover("Archive");

    private static TaskRuntimeInfo info(String id, TaskState state, String... actionPaths) {
        return new TaskRuntimeInfo(id, null, null, null, List.of(actionPaths), state, null, null, List.of());
    }

    @Test
    void disabledJobFolderIsMoved(@TempDir Path root) throws IOException {
        Path job = Files.createDirectories(root.resolve("REQ000000000001"));
        Files.writeString(job.resolve("REQ000000000001.cmd"), "@echo off");

        Optional<ArchiveMove> move = mover.archiveIfDisabled(info("REQ000000000001", TaskState.DISABLED,
                root.resolve("missing").resolve("run.cmd").toString(), "\"" + job.resolve("REQ000000000001.cmd") + "\""));

        assertTrue(move.isPresent());
        Path target = root.resolve("Archive").resolve("REQ000000000001");
        assertEquals(target, move.get().target());
        assertFalse(move.get().merged());
        assertFalse(Files.exists(job));
        assertTrue(Files.exists(target.resolve("REQ000000000001.cmd")));

        TaskRecord record = ArchiveMover.toRecord(move.get());
        assertEquals(Boolean.TRUE, record.get(RecordField.ARCHIVED));
        assertEquals(target.toString(), record.get(RecordField.ARCHIVE_FOLDER));
    }

    @Test
    void existingArchiveIsMergedInto(@TempDir Path root) throws IOException {
        Path job = Files.createDirectories(root.resolve("REQ000000000001"));
        Files.writeString(job.resolve("report.cmd"), "new");
        Files.createDirectories(job.resolve("log"));
        Files.writeString(job.resolve("log").resolve("fresh.log"), "fresh");

        Path target = Files.createDirectories(root.resolve("Archive").resolve("REQ000000000001"));
        Files.writeString(target.resolve("report.cmd"), "old");
        Files.writeString(target.resolve("keep.txt"), "kept");
        Files.createDirectories(target.resolve("log"));
        Files.writeString(target.resolve("log").resolve("stale.log"), "stale");

        ArchiveMove move = mover.move("REQ000000000001", job);

        assertTrue(move.merged());
        assertFalse(Files.exists(job));
        assertEquals("new", Files.readString(target.resolve("report.cmd")));
        assertEquals("kept", Files.readString(target.resolve("keep.txt")));
        assertTrue(Files.exists(target.resolve("log").resolve("fresh.log")));
        assertFalse(Files.exists(target.resolve("log").resolve("stale.log")));
    }

    @Test
    void enabledOrAlreadyArchivedJobsStay(@TempDir Path root) throws IOException {
        Path job = Files.createDirectories(root.resolve("REQ000000000001"));
        Files.writeString(job.resolve("a.cmd"), "x");
        Path archived = Files.createDirectories(root.resolve("Archive").resolve("REQ000000000002"));
        Files.writeString(archived.resolve("a.cmd"), "x");

        assertTrue(mover.archiveIfDisabled(info("REQ000000000001", TaskState.READY,
                job.resolve("a.cmd").toString())).isEmpty());
        assertTrue(mover.archiveIfDisabled(info("REQ000000000002", TaskState.DISABLED,
                archived.resolve("a.cmd").toString())).isEmpty());
        assertTrue(mover.archiveIfDisabled(info("REQ000000000003", TaskState.DISABLED)).isEmpty());
        assertTrue(Files.exists(job));
    }

    @Test
    void folderNamesWithCommasStayWhole(@TempDir Path root) throws IOException {
        Path job = Files.createDirectories(root.resolve("Sales, weekly").resolve("REQ000000000004"));
        Files.writeString(job.resolve("run.cmd"), "@echo off");

        Optional<ArchiveMove> move = mover.archiveIfDisabled(info("REQ000000000004", TaskState.DISABLED,
                job.resolve("run.cmd").toString()));

        assertTrue(move.isPresent());
        assertEquals(root.resolve("Sales, weekly").resolve("Archive").resolve("REQ000000000004"), move.get().target());
        assertTrue(Files.exists(move.get().target().resolve("run.cmd")));
    }

    @Test
    void reportGroupsMovesByParent(@TempDir Path root) {
        ArchiveReport report = new ArchiveReport();
        Path a = root.resolve("a");
        Path b = root.resolve("b");
        report.add(new ArchiveMove("REQ000000000002", a.resolve("REQ000000000002"), a.resolve("Archive/REQ000000000002"), false));
        report.add(new ArchiveMove("REQ000000000001", a.resolve("REQ000000000001"), a.resolve("Archive/REQ000000000001"), false));
        report.add(new ArchiveMove("RA0000000000001", b.resolve("RA0000000000001"), b.resolve("Archive/RA0000000000001"), true));

        Map<Path, List<ArchiveMove>> groups = report.groupedByParent();

        assertEquals(List.of(a, b), List.copyOf(groups.keySet()));
        assertEquals("REQ000000000001", groups.get(a).get(0).identifier());
        assertEquals(3, report.moves().size());
    }
}
