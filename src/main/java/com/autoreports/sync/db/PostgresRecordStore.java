package com.autoreports.sync.db;

import com.autoreports.sync.db.mybatis.AutoReportMapper;
import com.autoreports.sync.db.mybatis.AutoReportWriteParam;
import com.autoreports.sync.db.mybatis.ColumnValue;
import com.autoreports.sync.db.mybatis.MyBatisSupport;
import com.autoreports.sync.db.mybatis.RequestMapper;
import com.autoreports.sync.db.mybatis.SyncStateMapper;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * {@link RecordStore} on PostgreSQL through the MyBatis mappers. Holds one connection for the run.
 */
public final class PostgresRecordStore implements RecordStore {
    private static final Logger log = LogManager.getLogger(PostgresRecordStore.class);

    private final Database database;
    private Connection connection;

    public PostgresRecordStore(Database database) {
        this.database = database;
    }

    @Override
    public Map<String, Boolean> existsBatch(Collection<String> identifiers) throws RecordStoreException {
        List<String> ids = distinct(identifiers);
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String id : ids) {
            out.put(id, Boolean.FALSE);
        }
        if (ids.isEmpty()) {
            return out;
        }
        try (SqlSession session = MyBatisSupport.openSession(connection())) {
            for (String found : session.getMapper(AutoReportMapper.class).selectExistingTaskNames(ids)) {
                out.put(found, Boolean.TRUE);
            }
            return out;
        } catch (PersistenceException | SQLException e) {
            throw new RecordStoreException("existence check failed for " + ids.size() + " identifier(s)", e);
        }
    }

    @Override
    public Map<String, TaskRecord> fetchBatch(Collection<String> identifiers) throws RecordStoreException {
        List<String> ids = distinct(identifiers);
        Map<String, TaskRecord> out = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return out;
        }
        try (SqlSession session = MyBatisSupport.openSession(connection())) {
            for (Map<String, Object> row : session.getMapper(RequestMapper.class).selectByRequestIds(ids)) {
                TaskRecord record = primaryRecord(row);
                if (record != null) {
                    out.put(record.taskName(), record);
                }
            }
            return out;
        } catch (PersistenceException | SQLException e) {
            throw new RecordStoreException("request fetch failed for " + ids.size() + " identifier(s)", e);
        }
    }

    @Override
    public Map<String, TaskRecord> fetchStoredBatch(Collection<String> identifiers) throws RecordStoreException {
        List<String> ids = distinct(identifiers);
        Map<String, TaskRecord> out = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return out;
        }
        try (SqlSession session = MyBatisSupport.openSession(connection())) {
            for (Map<String, Object> row : session.getMapper(AutoReportMapper.class).selectByTaskNames(ids)) {
                Object name = row.get(RecordField.TASK_NAME.column());
                if (name != null) {
                    out.put(String.valueOf(name), TaskRecord.fromColumns(String.valueOf(name), row));
                }
            }
            return out;
        } catch (PersistenceException | SQLException e) {
            throw new RecordStoreException("registry fetch failed for " + ids.size() + " identifier(s)", e);
        }
    }

    @Override
    public BatchWriteResult insertBatch(List<TaskRecord> records) {
        return write(records, true);
    }

    @Override
    public BatchWriteResult updateBatch(List<TaskRecord> records) {
        return write(records, false);
    }

    private BatchWriteResult write(List<TaskRecord> records, boolean insert) {
        BatchWriteResult result = new BatchWriteResult();
        if (records == null || records.isEmpty()) {
            return result;
        }
        String op = insert ? "insert" : "update";
        Connection conn;
        try {
            conn = connection();
        } catch (SQLException e) {
            for (TaskRecord record : records) {
                result.failure(record.taskName(), e.getMessage());
            }
            log.error("{} batch skipped, no connection: {}", op, e.getMessage());
            return result;
        }

        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try (SqlSession session = MyBatisSupport.openSession(conn)) {
            AutoReportMapper mapper = session.getMapper(AutoReportMapper.class);
            for (TaskRecord record : records) {
                AutoReportWriteParam row = toParam(record, now);
                try {
                    int affected = insert ? mapper.insertRecord(row) : mapper.updateRecord(row);
                    conn.commit();
                    if (affected == 0) {
                        result.failure(record.taskName(), op + " affected no rows");
                        log.error("{} {}: no rows affected", op, record.taskName());
                    } else {
                        result.success(record.taskName());
                    }
                } catch (PersistenceException | SQLException e) {
                    rollbackQuietly(conn);
                    result.failure(record.taskName(), e.getMessage());
                    log.error("{} {} failed: {}", op, record.taskName(), e.getMessage());
                }
            }
            if (result.writtenCount() > 0) {
                session.getMapper(SyncStateMapper.class).saveState("last_" + op, result.writtenCount() + " row(s) at " + now, now);
                conn.commit();
            }
        } catch (PersistenceException | SQLException e) {
            rollbackQuietly(conn);
            log.warn("{} bookkeeping failed: {}", op, e.getMessage());
        }
        return result;
    }

    static AutoReportWriteParam toParam(TaskRecord record, OffsetDateTime now) {
        List<ColumnValue> columns = new ArrayList<>();
        for (Map.Entry<RecordField, Object> entry : record.asMap().entrySet()) {
            if (entry.getKey().isKey()) {
                continue;
            }
            columns.add(ColumnValue.builder().column(entry.getKey().column()).value(entry.getValue()).build());
        }
        return AutoReportWriteParam.builder()
                .taskName(record.taskName())
                .columns(columns)
                .updatedAt(now)
                .build();
    }

    static TaskRecord primaryRecord(Map<String, Object> row) {
        Object id = row.get(RecordField.REQUEST_ID.column());
        if (id == null || String.valueOf(id).isBlank()) {
            return null;
        }
        TaskRecord record = TaskRecord.fromColumns(String.valueOf(id).trim(), row);
        record.put(RecordField.CUSTOMER_ORGSTRUCTURE, normalizeOrgPath(record.getString(RecordField.CUSTOMER_ORGSTRUCTURE)));
        record.put(RecordField.RECEIVER_ORGSTRUCTURE, normalizeOrgPath(record.getString(RecordField.RECEIVER_ORGSTRUCTURE)));
        return record;
    }

    /**
     * Collapses runs of {@code /} and drops trailing ones.
     */
    public static String normalizeOrgPath(String raw) {
        if (raw == null) {
            return null;
        }
        String collapsed = raw.replaceAll("/{2,}", "/");
        int end = collapsed.length();
        while (end > 0 && collapsed.charAt(end - 1) == '/') {
            end--;
        }
        return collapsed.substring(0, end);
    }

    private Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = database.connect();
            connection.setAutoCommit(false);
        }
        return connection;
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("rollback failed: {}", e.getMessage());
        }
    }

    private static List<String> distinct(Collection<String> identifiers) {
        if (identifiers == null) {
            return List.of();
        }
        return new ArrayList<>(new LinkedHashSet<>(identifiers));
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("closing registry connection failed: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
