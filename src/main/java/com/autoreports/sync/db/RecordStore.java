package com.autoreports.sync.db;

import com.autoreports.sync.model.TaskRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persistent registry of auto reports plus the request registry it is seeded from.
 * Batch reads fail the whole call; batch writes report failures per record.
 */
public interface RecordStore extends AutoCloseable {

    /**
     * @return every requested identifier mapped to whether a registry row exists for it
     */
    Map<String, Boolean> existsBatch(Collection<String> identifiers) throws RecordStoreException;

    /**
     * Primary attributes from the request registry, keyed by identifier. Unknown identifiers are absent.
     */
    Map<String, TaskRecord> fetchBatch(Collection<String> identifiers) throws RecordStoreException;

    /**
     * Current registry rows, keyed by identifier, for delta computation.
     */
    Map<String, TaskRecord> fetchStoredBatch(Collection<String> identifiers) throws RecordStoreException;

    BatchWriteResult insertBatch(List<TaskRecord> records);

    /**
     * Writes only the fields present in each record.
     */
    BatchWriteResult updateBatch(List<TaskRecord> records);

    @Override
    void close();
}
