package com.autoreports.sync.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Columns of the auto-report registry row. {@link #TASK_NAME} is the join key of every source.
 */
public enum RecordField {
    REQUEST_ID("request_id"),
    CUSTOMER_LOGIN("customer_login"),
    CUSTOMER_NAME("customer_name"),
    CUSTOMER_COMPANY("customer_company"),
    CUSTOMER_ORGSTRUCTURE("customer_orgstructure"),
    RECEIVER_LOGIN("receiver_login"),
    RECEIVER_NAME("receiver_name"),
    RECEIVER_COMPANY("receiver_company"),
    RECEIVER_ORGSTRUCTURE("receiver_orgstructure"),
    REPORT_CREATE_DATE("report_create_date"),
    THEME("report_name"),
    EMAILS("report_recipients_email"),
    SENDER_TYPE("report_sender_type"),
    TASK_NAME("task_name"),
    TASK_LAST_RUN_DATE("task_last_run_date"),
    TASK_LAST_RUN_RESULT("task_last_run_result"),
    TASK_AUTHOR_LOGIN("task_author_login"),
    TASK_FILE_PATH("task_file_path"),
    TASK_FILE_NAME("task_file_name"),
    TASK_DESCRIPTION("task_description"),
    TASK_STATUS("task_status"),
    TASK_RUN_AS_USER("task_run_as_user"),
    TASK_TRIGGER_STATUS("task_trigger_status"),
    SCHEDULE_TYPE("task_schedule_type"),
    SCHEDULE_START_DATE("task_schedule_start_date"),
    SCHEDULE_DAYS_INTERVAL("task_schedule_days_interval"),
    SCHEDULE_WEEKS_INTERVAL("task_schedule_weeks_interval"),
    SCHEDULE_WEEK_DAYS("task_schedule_week_days"),
    SCHEDULE_MONTHS("task_schedule_months"),
    SCHEDULE_MONTH_DAYS("task_schedule_month_days"),
    SCHEDULE_REPEAT_EVERY("task_schedule_repeat_every"),
    SCHEDULE_REPEAT_UNTIL_TIME("task_schedule_repeat_until_time"),
    SCHEDULE_REPEAT_UNTIL_DURATION("task_schedule_repeat_until_duration"),
    DATABASE_TYPE("database_type"),
    DATABASE_HOSTNAME("database_hostname"),
    DELIVERY_LAST_DATE("delivery_last_date"),
    DELIVERY_STATUS("delivery_status"),
    DELIVERY_RECIPIENTS("delivery_recipients"),
    DELIVERY_ATTACHMENTS("delivery_attachments"),
    DELIVERY_MISSING_ATTACHMENTS("delivery_missing_attachments"),
    DELIVERY_ERROR("delivery_error"),
    ARCHIVED("archived"),
    ARCHIVE_FOLDER("archive_folder");

    private static final Map<String, RecordField> BY_COLUMN = new HashMap<>();

    static {
        for (RecordField field : values()) {
            BY_COLUMN.put(field.column, field);
        }
    }

    private final String column;

    RecordField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public boolean isKey() {
        return this == TASK_NAME;
    }

    public static RecordField fromColumn(String column) {
        if (column == null) {
            return null;
        }
        return BY_COLUMN.get(column.trim().toLowerCase(Locale.ROOT));
    }
}
