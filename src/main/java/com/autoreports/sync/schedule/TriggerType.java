package com.autoreports.sync.schedule;

import java.util.Locale;

/**
 * 模块说明：TriggerType（enum）。
 * 主要职责：声明式配置中的触发器类型与调度器类型码之间的映射。
 */
public enum TriggerType {
    ONE_TIME(1, "one_time"),
    DAILY(2, "daily"),
    WEEKLY(3, "weekly"),
    MONTHLY(4, "monthly");

    private final int code;
    private final String label;

    TriggerType(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static TriggerType fromText(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TriggerType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    public static TriggerType fromCode(Integer code) {
        if (code == null) {
            return null;
        }
        for (TriggerType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}
