package com.autoreports.sync.merge;

import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Keyed patch merge over {@code task_name}. Fields present in the incoming record (null values included)
 * overwrite the existing ones; absent fields are left alone.
 */
public final class RecordMerger {

    private RecordMerger() {
    }

    /**
     * Patches each existing record with the first incoming record of the same identifier.
     * Existing records without a match are returned unchanged. Inputs are not modified.
     */
    public static List<TaskRecord> merge(Collection<TaskRecord> existing, Collection<TaskRecord> incoming) {
        List<TaskRecord> out = new ArrayList<>();
        if (existing == null) {
            return out;
        }
        for (TaskRecord record : existing) {
            TaskRecord match = firstMatch(incoming, record.taskName());
            out.add(match == null ? record : apply(record, match));
        }
        return out;
    }

    /**
     * Chains {@link #merge} over ordered sources; a later source wins.
     */
    @SafeVarargs
    public static List<TaskRecord> mergeAll(Collection<TaskRecord> base, Collection<TaskRecord>... sources) {
        List<TaskRecord> current = merge(base, List.of());
        for (Collection<TaskRecord> source : sources) {
            current = merge(current, source);
        }
        return current;
    }

    public static TaskRecord apply(TaskRecord existing, TaskRecord patch) {
        if (!existing.taskName().equals(patch.taskName())) {
            throw new IllegalArgumentException("cannot merge " + patch.taskName() + " into " + existing.taskName());
        }
        TaskRecord merged = existing.copy();
        for (Map.Entry<RecordField, Object> entry : patch.asMap().entrySet()) {
            if (!entry.getKey().isKey()) {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }

    private static TaskRecord firstMatch(Collection<TaskRecord> incoming, String taskName) {
        if (incoming == null) {
            return null;
        }
        for (TaskRecord candidate : incoming) {
            if (candidate != null && taskName.equals(candidate.taskName())) {
                return candidate;
            }
        }
        return null;
    }
}
