package com.autoreports.sync.runner;

import com.autoreports.sync.model.RawTrigger;
import com.autoreports.sync.model.TaskRuntimeInfo;
import com.autoreports.sync.model.TaskState;
import com.autoreports.sync.schedule.ScheduleService;
import com.autoreports.sync.schedule.ScheduleTrigger;
import com.autoreports.sync.schedule.TaskDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

final class InMemoryScheduleService implements ScheduleService {
    final Map<String, TaskDefinition> tasks = new ConcurrentHashMap<>();
    final Set<String> disabled = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<TaskRuntimeInfo> readTask(String identifier) {
        TaskDefinition definition = tasks.get(identifier);
        if (definition == null) {
            return Optional.empty();
        }
        List<RawTrigger> triggers = new ArrayList<>();
        for (ScheduleTrigger trigger : definition.triggers) {
            triggers.add(trigger.toRawTrigger());
        }
        TaskState state = !definition.enabled || disabled.contains(identifier) ? TaskState.DISABLED : TaskState.READY;
        return Optional.of(new TaskRuntimeInfo(
                identifier,
                null,
                267011,
                definition.owner,
                List.of(definition.executablePath.toString()),
                state,
                "svc_reports",
                definition.description,
                triggers));
    }

    @Override
    public boolean upsertTask(TaskDefinition definition) {
        tasks.put(definition.identifier, definition);
        return true;
    }

    @Override
    public void close() {
    }
}
