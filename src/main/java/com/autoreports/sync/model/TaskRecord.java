package com.autoreports.sync.model;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One identifier's attributes from one source, or the merged union of all sources.
 * A field that is present with a {@code null} value is distinct from an absent field:
 * merging overwrites with the former and leaves the latter untouched.
 */
public final class TaskRecord {
    private final String taskName;
    private final EnumMap<RecordField, Object> values = new EnumMap<>(RecordField.class);

    public TaskRecord(String taskName) {
        if (taskName == null || taskName.trim().isEmpty()) {
            throw new IllegalArgumentException("task_name must not be empty");
        }
        this.taskName = taskName.trim();
        values.put(RecordField.TASK_NAME, this.taskName);
    }

    /**
     * Builds a record from a column-keyed row; unknown columns are ignored and SQL timestamps become local date-times.
     */
    public static TaskRecord fromColumns(String taskName, Map<String, ?> row) {
        TaskRecord record = new TaskRecord(taskName);
        if (row == null) {
            return record;
        }
        for (Map.Entry<String, ?> entry : row.entrySet()) {
            RecordField field = RecordField.fromColumn(entry.getKey());
            if (field == null || field.isKey()) {
                continue;
            }
            record.put(field, normalizeValue(entry.getValue()));
        }
        return record;
    }

    public String taskName() {
        return taskName;
    }

    public TaskRecord put(RecordField field, Object value) {
        Objects.requireNonNull(field, "field");
        if (field.isKey()) {
            if (!taskName.equals(value)) {
                throw new IllegalArgumentException("task_name is immutable: " + taskName + " -> " + value);
            }
            return this;
        }
        values.put(field, normalizeValue(value));
        return this;
    }

    /**
     * Puts the value only when it is non-null and, for text, non-blank.
     */
    public TaskRecord putIfPresent(RecordField field, Object value) {
        if (value == null) {
            return this;
        }
        if (value instanceof String text && text.trim().isEmpty()) {
            return this;
        }
        return put(field, value);
    }

    public boolean has(RecordField field) {
        return values.containsKey(field);
    }

    public Object get(RecordField field) {
        return values.get(field);
    }

    public String getString(RecordField field) {
        Object value = values.get(field);
        return value == null ? null : String.valueOf(value);
    }

    public Set<RecordField> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<RecordField, Object> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public TaskRecord copy() {
        TaskRecord copy = new TaskRecord(taskName);
        copy.values.putAll(values);
        return copy;
    }

    /**
     * Non-key fields whose value differs from {@code stored}; a field absent here is never reported.
     */
    public Map<RecordField, Object> changesAgainst(TaskRecord stored) {
        Map<RecordField, Object> out = new EnumMap<>(RecordField.class);
        for (Map.Entry<RecordField, Object> entry : values.entrySet()) {
            if (entry.getKey().isKey()) {
                continue;
            }
            Object previous = stored == null ? null : stored.get(entry.getKey());
            if (!Objects.equals(previous, entry.getValue())) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.withNano(0);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskRecord other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TaskRecord" + values;
    }
}
