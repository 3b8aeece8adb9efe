package com.autoreports.sync.schedule;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Runs an external command and captures its combined output.
 */
public interface CommandExecutor {

    record Result(int exitCode, String output) {
        public boolean ok() {
            return exitCode == 0;
        }
    }

    Result run(List<String> command, Charset outputCharset) throws IOException, InterruptedException;
}
