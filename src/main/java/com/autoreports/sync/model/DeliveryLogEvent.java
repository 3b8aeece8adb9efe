package com.autoreports.sync.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 模块说明：DeliveryLogEvent（class）。
 * 主要职责：承载投递日志中解析出的一条结构化事件。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class DeliveryLogEvent {
    public final LocalDateTime timestamp;
    public final DeliveryStatus status;
    public final List<String> recipients;
    public final List<String> attachments;
    public final List<String> missingAttachments;
    public final String errorMessage;

    public DeliveryLogEvent(
            LocalDateTime timestamp,
            DeliveryStatus status,
            List<String> recipients,
            List<String> attachments,
            List<String> missingAttachments,
            String errorMessage
    ) {
        this.timestamp = timestamp;
        this.status = status;
        this.recipients = recipients == null ? List.of() : List.copyOf(recipients);
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
        this.missingAttachments = missingAttachments == null ? List.of() : List.copyOf(missingAttachments);
        this.errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public DeliveryLogEvent withStatus(DeliveryStatus newStatus, String newErrorMessage) {
        return new DeliveryLogEvent(timestamp, newStatus, recipients, attachments, missingAttachments, newErrorMessage);
    }

    public TaskRecord toRecord(String taskName) {
        TaskRecord record = new TaskRecord(taskName);
        record.put(RecordField.DELIVERY_LAST_DATE, timestamp);
        record.put(RecordField.DELIVERY_STATUS, status == null ? null : status.label());
        record.put(RecordField.DELIVERY_RECIPIENTS, joinOrNull(recipients));
        record.put(RecordField.DELIVERY_ATTACHMENTS, joinOrNull(attachments));
        record.put(RecordField.DELIVERY_MISSING_ATTACHMENTS, joinOrNull(missingAttachments));
        record.put(RecordField.DELIVERY_ERROR, errorMessage.isBlank() ? null : errorMessage.trim());
        return record;
    }

    private static String joinOrNull(List<String> values) {
        return values.isEmpty() ? null : String.join(";", values);
    }
}
