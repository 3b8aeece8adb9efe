package com.autoreports.sync.model;

/**
 * 模块说明：TaskState（enum）。
 * 主要职责：映射调度器返回的任务状态码（0-4）。
 */
public enum TaskState {
    UNKNOWN(0, "Unknown"),
    DISABLED(1, "Disabled"),
    QUEUED(2, "Queued"),
    READY(3, "Enabled"),
    RUNNING(4, "Running");

    private final int code;
    private final String label;

    TaskState(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static TaskState fromCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (TaskState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return UNKNOWN;
    }
}
