package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import com.autoreports.sync.model.TaskRuntimeInfo;
import com.autoreports.sync.model.TaskState;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScheduleRecordNormalizerTest {

    @Test
    void runtimeInfoIsFlattenedIntoRecord() {
        ScheduleRecordNormalizer normalizer = new ScheduleRecordNormalizer(new TriggerNormalizer(-1), "domain_name\\");
        TaskRuntimeInfo info = new TaskRuntimeInfo(
                "REQ000000000001",
                LocalDateTime.of(2026, 10, 19, 9, 0, 5),
                0,
                "DOMAIN_NAME\\jdoe",
                List.of("\"D:\\reports\\REQ000000000001\\REQ000000000001.cmd\"", "D:\\reports\\REQ000000000001\\extra.cmd"),
                TaskState.READY,
                "svc_reports",
                "Daily sales",
                List.of(RawTrigger.builder().typeCode(2).daysInterval(1).enabled(true).build())
        );

        TaskRecord record = normalizer.normalize(info);

        assertEquals("REQ000000000001", record.taskName());
        assertEquals(LocalDateTime.of(2026, 10, 19, 8, 0, 5), record.get(RecordField.TASK_LAST_RUN_DATE));
        assertEquals("Success", record.get(RecordField.TASK_LAST_RUN_RESULT));
        assertEquals("jdoe", record.get(RecordField.TASK_AUTHOR_LOGIN));
        assertEquals("Enabled", record.get(RecordField.TASK_STATUS));
        assertEquals("D:\\reports\\REQ000000000001", record.get(RecordField.TASK_FILE_PATH));
        assertEquals("REQ000000000001.cmd, extra.cmd", record.get(RecordField.TASK_FILE_NAME));
        assertEquals("daily", record.get(RecordField.SCHEDULE_TYPE));
    }

    @Test
    void unknownResultCodesShareOneLabel() {
        assertEquals("Not yet run", ScheduleRecordNormalizer.lastResultLabel(267011));
        assertEquals("Unknown result", ScheduleRecordNormalizer.lastResultLabel(42));
        assertEquals("Unknown result", ScheduleRecordNormalizer.lastResultLabel(null));
    }

    @Test
    void domainPrefixMatchesRegardlessOfDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ScheduleRecordNormalizer normalizer = new ScheduleRecordNormalizer(new TriggerNormalizer(-1), "domain_name\\");

            assertEquals("jdoe", normalizer.stripDomain("DOMAIN_NAME\\jdoe"));
            assertEquals("OTHER\\jdoe", normalizer.stripDomain("OTHER\\jdoe"));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
