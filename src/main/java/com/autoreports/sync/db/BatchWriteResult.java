package com.autoreports.sync.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batched insert or update: identifiers written, and per-identifier failure messages.
 */
public final class BatchWriteResult {
    private final List<String> written = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public void success(String taskName) {
        written.add(taskName);
    }

    public void failure(String taskName, String message) {
        failures.put(taskName, message == null ? "unknown error" : message);
    }

    public Map<String, String> failures() {
        return Collections.unmodifiableMap(failures);
    }

    public int writtenCount() {
        return written.size();
    }

    public int failedCount() {
        return failures.size();
    }
}
