package com.autoreports.sync.schedule;

import java.util.List;

/**
 * 模块说明：TaskSpec（class）。
 * 主要职责：承载 &lt;ID&gt;.json 声明式调度文件的任务级字段与触发器列表。
 */
public final class TaskSpec {
    public final List<TriggerSpec> triggers;
    public final String description;
    public final Boolean enabled;
    public final String stopIfRunsLonger;

    public TaskSpec(List<TriggerSpec> triggers, String description, Boolean enabled, String stopIfRunsLonger) {
        this.triggers = triggers == null ? List.of() : List.copyOf(triggers);
        this.description = description;
        this.enabled = enabled;
        this.stopIfRunsLonger = stopIfRunsLonger;
    }
}
