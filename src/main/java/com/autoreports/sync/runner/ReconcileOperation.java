package com.autoreports.sync.runner;

/**
 * 模块说明：ReconcileOperation（enum）。
 * 主要职责：区分每日更新与新增登记两种对账批次。
 */
public enum ReconcileOperation {
    UPDATE("daily_update"),
    INSERT("insert");

    private final String label;

    ReconcileOperation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
