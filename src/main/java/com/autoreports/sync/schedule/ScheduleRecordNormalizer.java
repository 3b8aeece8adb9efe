package com.autoreports.sync.schedule;

import com.autoreports.sync.config.Config;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import com.autoreports.sync.model.TaskRuntimeInfo;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：ScheduleRecordNormalizer（class）。
 * 主要职责：把调度器读回的 TaskRuntimeInfo 转换为统一字段的 TaskRecord。
 * 使用建议：结果码、状态标签与触发器字段格式需与历史数据保持一致。
 */
public final class ScheduleRecordNormalizer {
    private static final Map<Integer, String> LAST_RESULT_LABELS = Map.of(
            0, "Success",
            1, "General error",
            267008, "Running",
            267009, "Ready",
            267010, "Completed",
            267011, "Not yet run",
            267012, "Disabled",
            267013, "Not scheduled",
            267014, "Skipped due to sleep"
    );

    private final TriggerNormalizer triggerNormalizer;
    private final String domainPrefix;

    public ScheduleRecordNormalizer(TriggerNormalizer triggerNormalizer, String domainPrefix) {
        this.triggerNormalizer = triggerNormalizer;
        this.domainPrefix = domainPrefix == null ? "" : domainPrefix;
    }

    public static ScheduleRecordNormalizer fromConfig(Config config) {
        return new ScheduleRecordNormalizer(
                new TriggerNormalizer(config.getInt("schedule.read-offset-hours", -1)),
                config.getString("schedule.domain-prefix", "")
        );
    }

    public static String lastResultLabel(Integer code) {
        if (code == null) {
            return "Unknown result";
        }
        return LAST_RESULT_LABELS.getOrDefault(code, "Unknown result");
    }

    public TaskRecord normalize(TaskRuntimeInfo info) {
        TaskRecord record = new TaskRecord(info.identifier);
        record.put(RecordField.TASK_LAST_RUN_DATE, triggerNormalizer.shift(info.lastRunTime));
        record.put(RecordField.TASK_LAST_RUN_RESULT, lastResultLabel(info.lastResultCode));
        record.put(RecordField.TASK_AUTHOR_LOGIN, stripDomain(info.author));
        record.put(RecordField.TASK_DESCRIPTION, info.description);
        record.put(RecordField.TASK_STATUS, info.state.label());
        record.put(RecordField.TASK_RUN_AS_USER, info.runAsUser);

        List<String> folders = info.actionFolders();
        List<String> names = info.actionFileNames();
        record.put(RecordField.TASK_FILE_PATH, folders.isEmpty() ? null : String.join(", ", folders));
        record.put(RecordField.TASK_FILE_NAME, names.isEmpty() ? null : String.join(", ", names));

        for (Map.Entry<RecordField, String> entry : triggerNormalizer.normalize(info.triggers).entrySet()) {
            record.put(entry.getKey(), entry.getValue());
        }
        return record;
    }

    String stripDomain(String author) {
        if (author == null || author.isBlank()) {
            return null;
        }
        String value = author.trim();
        if (!domainPrefix.isEmpty() && value.toLowerCase(Locale.ROOT).startsWith(domainPrefix.toLowerCase(Locale.ROOT))) {
            return value.substring(domainPrefix.length());
        }
        return value;
    }
}
