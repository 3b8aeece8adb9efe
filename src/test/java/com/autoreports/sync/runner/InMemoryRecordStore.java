package com.autoreports.sync.runner;

import com.autoreports.sync.db.BatchWriteResult;
import com.autoreports.sync.db.RecordStore;
import com.autoreports.sync.db.RecordStoreException;
import com.autoreports.sync.merge.RecordMerger;
import com.autoreports.sync.model.TaskRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class InMemoryRecordStore implements RecordStore {
    final Map<String, TaskRecord> rows = new LinkedHashMap<>();
    final Map<String, TaskRecord> requests = new LinkedHashMap<>();
    final List<TaskRecord> inserted = new ArrayList<>();
    final List<TaskRecord> updated = new ArrayList<>();
    Set<String> rejectWrites = Set.of();
    boolean failReads;
    boolean closed;

    @Override
    public Map<String, Boolean> existsBatch(Collection<String> identifiers) throws RecordStoreException {
        checkReads();
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String id : identifiers) {
            out.put(id, rows.containsKey(id));
        }
        return out;
    }

    @Override
    public Map<String, TaskRecord> fetchBatch(Collection<String> identifiers) throws RecordStoreException {
        checkReads();
        Map<String, TaskRecord> out = new LinkedHashMap<>();
        for (String id : identifiers) {
            if (requests.containsKey(id)) {
                out.put(id, requests.get(id).copy());
            }
        }
        return out;
    }

    @Override
    public Map<String, TaskRecord> fetchStoredBatch(Collection<String> identifiers) throws RecordStoreException {
        checkReads();
        Map<String, TaskRecord> out = new LinkedHashMap<>();
        for (String id : identifiers) {
            if (rows.containsKey(id)) {
                out.put(id, rows.get(id).copy());
            }
        }
        return out;
    }

    @Override
    public BatchWriteResult insertBatch(List<TaskRecord> records) {
        BatchWriteResult result = new BatchWriteResult();
        for (TaskRecord record : records) {
            if (rejectWrites.contains(record.taskName())) {
                result.failure(record.taskName(), "duplicate key value violates unique constraint");
                continue;
            }
            rows.put(record.taskName(), record.copy());
            inserted.add(record);
            result.success(record.taskName());
        }
        return result;
    }

    @Override
    public BatchWriteResult updateBatch(List<TaskRecord> records) {
        BatchWriteResult result = new BatchWriteResult();
        for (TaskRecord record : records) {
            TaskRecord current = rows.get(record.taskName());
            if (current == null || rejectWrites.contains(record.taskName())) {
                result.failure(record.taskName(), "no row updated");
                continue;
            }
            rows.put(record.taskName(), RecordMerger.apply(current, record));
            updated.add(record);
            result.success(record.taskName());
        }
        return result;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void checkReads() throws RecordStoreException {
        if (failReads) {
            throw new RecordStoreException("connection refused");
        }
    }
}
