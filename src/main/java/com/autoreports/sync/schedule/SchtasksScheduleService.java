package com.autoreports.sync.schedule;

import com.autoreports.sync.config.Config;
import com.autoreports.sync.model.TaskRuntimeInfo;
import com.autoreports.sync.model.TaskState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ScheduleService} over the Windows Task Scheduler through the {@code schtasks} command line.
 * Definitions are registered from Task Scheduler XML; runtime state comes from the verbose list query.
 */
public final class SchtasksScheduleService implements ScheduleService {
    private static final Logger log = LogManager.getLogger(SchtasksScheduleService.class);

    private static final List<DateTimeFormatter> RUN_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("M/d/yyyy h:mm:ss a", Locale.US),
            DateTimeFormatter.ofPattern("d.M.yyyy H:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd H:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy H:mm")
    );
    private static final LocalDateTime NEVER_RUN_BEFORE = LocalDateTime.of(2000, 1, 1, 0, 0);

    private final CommandExecutor executor;
    private final String folder;
    private final Charset consoleCharset;
    private final Path workDir;

    public SchtasksScheduleService(CommandExecutor executor, String folder, Charset consoleCharset, Path workDir) {
        this.executor = executor;
        this.folder = folder == null || folder.isBlank() ? "\\" : folder.trim();
        this.consoleCharset = consoleCharset;
        this.workDir = workDir;
    }

    public static SchtasksScheduleService fromConfig(Config config) {
        return new SchtasksScheduleService(
                new ProcessCommandExecutor(config.getLong("schedule.command-timeout-seconds", 60)),
                config.requireString("schedule.folder"),
                Charset.forName(config.getString("schedule.console-charset", "IBM866")),
                config.getPath("outputs.dir")
        );
    }

    public String taskPath(String identifier) {
        return folder.endsWith("\\") ? folder + identifier : folder + "\\" + identifier;
    }

    @Override
    public Optional<TaskRuntimeInfo> readTask(String identifier) throws ScheduleServiceException {
        String name = taskPath(identifier);
        CommandExecutor.Result xml = exec(List.of("schtasks", "/Query", "/TN", name, "/XML"), name);
        if (!xml.ok()) {
            log.debug("task {} not found: {}", name, xml.output().trim());
            return Optional.empty();
        }
        TaskXml.ParsedTask parsed;
        try {
            parsed = TaskXml.parse(xml.output());
        } catch (IllegalArgumentException e) {
            throw new ScheduleServiceException("unreadable definition of " + name, e);
        }

        CommandExecutor.Result list = exec(List.of("schtasks", "/Query", "/TN", name, "/V", "/FO", "LIST"), name);
        Map<String, String> fields = list.ok() ? parseList(list.output()) : Map.of();
        if (!list.ok()) {
            log.warn("runtime query failed for {}: {}", name, list.output().trim());
        }

        TaskState state = parseState(fields.get("Status"), fields.get("Scheduled Task State"), parsed.enabled);
        String runAs = firstNonBlank(fields.get("Run As User"), parsed.userId);
        String author = firstNonBlank(parsed.author, fields.get("Author"));
        return Optional.of(new TaskRuntimeInfo(
                identifier,
                parseRunTime(fields.get("Last Run Time")),
                parseResult(fields.get("Last Result")),
                author,
                parsed.actionPaths,
                state,
                runAs,
                parsed.description,
                parsed.triggers
        ));
    }

    @Override
    public boolean upsertTask(TaskDefinition definition) throws ScheduleServiceException {
        String name = taskPath(definition.identifier);
        Path xmlFile = null;
        try {
            Files.createDirectories(workDir);
            xmlFile = Files.createTempFile(workDir, definition.identifier + "-", ".xml");
            Files.write(xmlFile, TaskXml.write(definition, name));
            CommandExecutor.Result result = exec(
                    List.of("schtasks", "/Create", "/TN", name, "/XML", xmlFile.toString(), "/F"), name);
            if (!result.ok()) {
                log.warn("schtasks rejected {}: {}", name, result.output().trim());
                return false;
            }
            log.info("registered task {} with {} trigger(s)", name, definition.triggers.size());
            return true;
        } catch (IOException e) {
            throw new ScheduleServiceException("cannot stage task xml for " + name, e);
        } finally {
            if (xmlFile != null) {
                try {
                    Files.deleteIfExists(xmlFile);
                } catch (IOException e) {
                    log.warn("cannot delete staged xml {}: {}", xmlFile, e.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        // each call is a separate process
    }

    private CommandExecutor.Result exec(List<String> command, String name) throws ScheduleServiceException {
        try {
            return executor.run(command, consoleCharset);
        } catch (IOException e) {
            throw new ScheduleServiceException("schtasks failed for " + name + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScheduleServiceException("interrupted while querying " + name, e);
        }
    }

    /**
     * Parses {@code Key: value} lines; the first occurrence wins since trigger sections repeat keys.
     */
    static Map<String, String> parseList(String output) {
        Map<String, String> out = new LinkedHashMap<>();
        if (output == null) {
            return out;
        }
        for (String line : output.split("\\R")) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            out.putIfAbsent(key, value);
        }
        return out;
    }

    static TaskState parseState(String status, String scheduledState, boolean definitionEnabled) {
        if (!definitionEnabled || "Disabled".equalsIgnoreCase(trimToEmpty(scheduledState))) {
            return TaskState.DISABLED;
        }
        switch (trimToEmpty(status).toLowerCase(Locale.ROOT)) {
            case "ready":
                return TaskState.READY;
            case "running":
                return TaskState.RUNNING;
            case "queued":
                return TaskState.QUEUED;
            case "disabled":
                return TaskState.DISABLED;
            default:
                return TaskState.UNKNOWN;
        }
    }

    static LocalDateTime parseRunTime(String raw) {
        String value = trimToEmpty(raw);
        if (value.isEmpty() || "N/A".equalsIgnoreCase(value)) {
            return null;
        }
        for (DateTimeFormatter format : RUN_TIME_FORMATS) {
            try {
                LocalDateTime parsed = LocalDateTime.parse(value, format);
                return parsed.isBefore(NEVER_RUN_BEFORE) ? null : parsed;
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        log.debug("unrecognized last run time: {}", value);
        return null;
    }

    static Integer parseResult(String raw) {
        String value = trimToEmpty(raw);
        if (value.isEmpty()) {
            return null;
        }
        try {
            if (value.toLowerCase(Locale.ROOT).startsWith("0x")) {
                return (int) Long.parseLong(value.substring(2), 16);
            }
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
