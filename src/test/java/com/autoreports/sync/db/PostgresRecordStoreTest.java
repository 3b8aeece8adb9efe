package com.autoreports.sync.db;

import com.autoreports.sync.db.mybatis.AutoReportWriteParam;
import com.autoreports.sync.db.mybatis.ColumnValue;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostgresRecordStoreTest {

    @Test
    void orgPathCollapsesSlashes() {
        assertEquals("Company/Sales/North", PostgresRecordStore.normalizeOrgPath("Company//Sales///North//"));
        assertEquals("", PostgresRecordStore.normalizeOrgPath("///"));
        assertNull(PostgresRecordStore.normalizeOrgPath(null));
    }

    @Test
    void writeParamCarriesPresentFieldsOnlyWithoutKey() {
        TaskRecord record = new TaskRecord("REQ000000000001")
                .put(RecordField.THEME, "Daily Report")
                .put(RecordField.DELIVERY_ERROR, null);
        OffsetDateTime now = OffsetDateTime.of(2026, 10, 19, 5, 0, 0, 0, ZoneOffset.UTC);

        AutoReportWriteParam param = PostgresRecordStore.toParam(record, now);

        assertEquals("REQ000000000001", param.getTaskName());
        assertEquals(now, param.getUpdatedAt());
        List<String> columns = param.getColumns().stream().map(ColumnValue::getColumn).collect(Collectors.toList());
        assertEquals(List.of("report_name", "delivery_error"), columns);
        assertNull(param.getColumns().get(1).getValue());
    }

    @Test
    void primaryRecordIsKeyedByRequestId() {
        Map<String, Object> row = new HashMap<>();
        row.put("request_id", " REQ000000000001 ");
        row.put("customer_login", "jdoe");
        row.put("customer_orgstructure", "Company//IT/");
        row.put("not_a_column", "ignored");

        TaskRecord record = PostgresRecordStore.primaryRecord(row);

        assertEquals("REQ000000000001", record.taskName());
        assertEquals("jdoe", record.get(RecordField.CUSTOMER_LOGIN));
        assertEquals("Company/IT", record.get(RecordField.CUSTOMER_ORGSTRUCTURE));
        assertTrue(record.has(RecordField.RECEIVER_ORGSTRUCTURE));
        assertNull(PostgresRecordStore.primaryRecord(Map.of("customer_login", "x")));
    }
}
