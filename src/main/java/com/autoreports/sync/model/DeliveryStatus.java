package com.autoreports.sync.model;

/**
 * 模块说明：DeliveryStatus（enum）。
 * 主要职责：描述投递日志中一次发送的结果。
 */
public enum DeliveryStatus {
    SUCCESS("Success"),
    ISSUE("Issue"),
    SEND_ERROR("SendError");

    private final String label;

    DeliveryStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DeliveryStatus fromLabel(String raw) {
        if (raw == null) {
            return null;
        }
        for (DeliveryStatus status : values()) {
            if (status.label.equalsIgnoreCase(raw.trim())) {
                return status;
            }
        }
        return null;
    }
}
