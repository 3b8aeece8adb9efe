package com.autoreports.sync.schedule;

import java.nio.file.Path;
import java.util.List;

/**
 * 模块说明：TaskDefinition（class）。
 * 主要职责：承载注册到调度器的任务定义（执行文件、描述、触发器、状态、作者、超时）。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class TaskDefinition {
    public final String identifier;
    public final Path executablePath;
    public final String description;
    public final List<ScheduleTrigger> triggers;
    public final boolean enabled;
    public final String owner;
    public final String executionTimeLimit;

    public TaskDefinition(
            String identifier,
            Path executablePath,
            String description,
            List<ScheduleTrigger> triggers,
            boolean enabled,
            String owner,
            String executionTimeLimit
    ) {
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("task definition needs at least one trigger: " + identifier);
        }
        this.identifier = identifier;
        this.executablePath = executablePath;
        this.description = description;
        this.triggers = List.copyOf(triggers);
        this.enabled = enabled;
        this.owner = owner;
        this.executionTimeLimit = executionTimeLimit;
    }
}
