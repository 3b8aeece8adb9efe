package com.autoreports.sync.schedule;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}; stderr is merged into the captured output.
 * Output goes to a temp file so the timeout applies while the command is still writing.
 */
public final class ProcessCommandExecutor implements CommandExecutor {
    private final long timeoutSeconds;

    public ProcessCommandExecutor(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds <= 0 ? 60 : timeoutSeconds;
    }

    @Override
    public Result run(List<String> command, Charset outputCharset) throws IOException, InterruptedException {
        Path capture = Files.createTempFile("autoreports-cmd-", ".out");
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(capture.toFile())
                    .start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new IOException("command timed out after " + timeoutSeconds + "s: " + command.get(0));
            }
            return new Result(process.exitValue(), new String(Files.readAllBytes(capture), outputCharset));
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(capture);
        }
    }
}
