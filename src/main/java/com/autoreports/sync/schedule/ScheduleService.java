package com.autoreports.sync.schedule;

import com.autoreports.sync.model.TaskRuntimeInfo;

import java.util.Optional;

/**
 * Host job scheduler, restricted to the registry's dedicated task folder.
 */
public interface ScheduleService extends AutoCloseable {

    /**
     * @return the task's runtime view, or empty when no such task is registered
     */
    Optional<TaskRuntimeInfo> readTask(String identifier) throws ScheduleServiceException;

    /**
     * Creates the task or replaces an existing one with the same identifier.
     *
     * @return whether the scheduler accepted the definition
     */
    boolean upsertTask(TaskDefinition definition) throws ScheduleServiceException;

    @Override
    void close();
}
