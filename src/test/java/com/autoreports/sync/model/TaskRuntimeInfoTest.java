package com.autoreports.sync.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskRuntimeInfoTest {

    private static TaskRuntimeInfo withActions(String... actions) {
        return new TaskRuntimeInfo("REQ000000000001", null, null, null, Arrays.asList(actions),
                TaskState.READY, null, null, List.of());
    }

    @Test
    void actionFoldersKeepCommasAndDropDuplicates() {
        TaskRuntimeInfo info = withActions(
                "\"D:\\reports\\Sales, weekly\\REQ000000000001\\REQ000000000001.cmd\"",
                "D:\\reports\\Sales, weekly\\REQ000000000001\\extra.cmd",
                "  ",
                "cleanup.cmd");

        assertEquals(List.of("D:\\reports\\Sales, weekly\\REQ000000000001"), info.actionFolders());
        assertEquals(List.of("REQ000000000001.cmd", "extra.cmd", "cleanup.cmd"), info.actionFileNames());
    }

    @Test
    void noActionsMeansNoFolders() {
        TaskRuntimeInfo info = new TaskRuntimeInfo("REQ000000000001", null, null, null, null,
                null, null, null, null);

        assertTrue(info.actionFolders().isEmpty());
        assertTrue(info.actionFileNames().isEmpty());
        assertEquals(TaskState.UNKNOWN, info.state);
    }
}
