package com.autoreports.sync.schedule;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandExecutorTest {

    @Test
    void capturesOutputAndExitCode() throws Exception {
        CommandExecutor.Result result = new ProcessCommandExecutor(10)
                .run(List.of("sh", "-c", "echo task-output; echo oops 1>&2; exit 3"), StandardCharsets.UTF_8);

        assertEquals(3, result.exitCode());
        assertTrue(result.output().contains("task-output"));
        assertTrue(result.output().contains("oops"));
    }

    @Test
    void hungCommandIsKilledAfterTimeout() {
        long started = System.nanoTime();
        IOException e = assertThrows(IOException.class,
                () -> new ProcessCommandExecutor(1).run(List.of("sleep", "6"), StandardCharsets.UTF_8));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(e.getMessage().contains("timed out after 1s"), e.getMessage());
        assertTrue(elapsedMs < 4_000L, "took " + elapsedMs + " ms");
    }
}
