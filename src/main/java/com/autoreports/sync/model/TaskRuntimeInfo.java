package com.autoreports.sync.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 模块说明：TaskRuntimeInfo（class）。
 * 主要职责：承载从调度器读回的任务运行信息与触发器列表。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class TaskRuntimeInfo {
    public final String identifier;
    public final LocalDateTime lastRunTime;
    public final Integer lastResultCode;
    public final String author;
    public final List<String> actionPaths;
    public final TaskState state;
    public final String runAsUser;
    public final String description;
    public final List<RawTrigger> triggers;

    public TaskRuntimeInfo(
            String identifier,
            LocalDateTime lastRunTime,
            Integer lastResultCode,
            String author,
            List<String> actionPaths,
            TaskState state,
            String runAsUser,
            String description,
            List<RawTrigger> triggers
    ) {
        this.identifier = identifier;
        this.lastRunTime = lastRunTime;
        this.lastResultCode = lastResultCode;
        this.author = author;
        this.actionPaths = actionPaths == null ? List.of() : List.copyOf(actionPaths);
        this.state = state == null ? TaskState.UNKNOWN : state;
        this.runAsUser = runAsUser;
        this.description = description;
        this.triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public boolean isDisabled() {
        return state == TaskState.DISABLED;
    }

    /**
     * Distinct parent folders of the action executables, in action order.
     */
    public List<String> actionFolders() {
        Set<String> folders = new LinkedHashSet<>();
        for (String path : unquotedActions()) {
            int cut = lastSeparator(path);
            if (cut >= 0) {
                folders.add(path.substring(0, cut));
            }
        }
        return List.copyOf(folders);
    }

    /**
     * Distinct executable file names, in action order.
     */
    public List<String> actionFileNames() {
        Set<String> names = new LinkedHashSet<>();
        for (String path : unquotedActions()) {
            names.add(path.substring(lastSeparator(path) + 1));
        }
        return List.copyOf(names);
    }

    private List<String> unquotedActions() {
        List<String> out = new ArrayList<>();
        for (String action : actionPaths) {
            if (action == null || action.isBlank()) {
                continue;
            }
            String path = action.trim();
            if (path.length() > 1 && path.startsWith("\"") && path.endsWith("\"")) {
                path = path.substring(1, path.length() - 1);
            }
            out.add(path);
        }
        return out;
    }

    private static int lastSeparator(String path) {
        return Math.max(path.lastIndexOf('\\'), path.lastIndexOf('/'));
    }
}
