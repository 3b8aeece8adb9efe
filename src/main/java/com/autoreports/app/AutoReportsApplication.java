package com.autoreports.app;

import com.autoreports.app.properties.MailProperties;
import com.autoreports.core.IssueSeverity;
import com.autoreports.core.RunSummary;
import com.autoreports.sync.archive.ArchiveReport;
import com.autoreports.sync.config.Config;
import com.autoreports.sync.db.Database;
import com.autoreports.sync.db.PostgresRecordStore;
import com.autoreports.sync.output.Mailer;
import com.autoreports.sync.output.NotificationRenderer;
import com.autoreports.sync.runner.ReconcileOperation;
import com.autoreports.sync.runner.ReconciliationRunner;
import com.autoreports.sync.schedule.SchtasksScheduleService;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class AutoReportsApplication {
    static final String INSERT_TODAY = "insert";

    private static volatile boolean LOG_ROUTE_INSTALLED = false;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    public static void main(String[] args) {
        int exit = new AutoReportsApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("autoreports", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("autoreports", options);
            return 0;
        }

        return execute(parseTasks(cmd.getOptionValue("tasks", "")), Path.of(".").toAbsolutePath().normalize());
    }

    int execute(Set<String> tasks, Path workingDir) {
        Config config;
        ZoneId zone;
        try {
            config = Config.load(workingDir);
            zone = ZoneId.of(config.getString("app.zone"));
            installLogRoutingIfNeeded(config);
        } catch (Exception e) {
            System.err.println("FATAL: configuration unusable: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
        Logger log = LogManager.getLogger(AutoReportsApplication.class);
        Clock clock = Clock.system(zone);
        AutoReportsBootstrap bootstrap = new AutoReportsBootstrap(config);
        List<RunSummary> summaries = new ArrayList<>();
        ArchiveReport archive = new ArchiveReport();

        try {
            Database database = bootstrap.database();
            log.info("DB url={}, schema={}", database.maskedJdbcUrl(), database.schema());
            try (PostgresRecordStore store = new PostgresRecordStore(database);
                 SchtasksScheduleService scheduleService = SchtasksScheduleService.fromConfig(config)) {
                ReconciliationRunner runner = ReconciliationRunner.fromConfig(config, store, scheduleService, clock);
                if (tasks.isEmpty() || tasks.contains(ReconcileOperation.UPDATE.label())) {
                    summaries.add(runner.runUpdate(archive));
                }
                Set<String> insertIds = new LinkedHashSet<>(tasks);
                insertIds.remove(ReconcileOperation.UPDATE.label());
                boolean insertToday = insertIds.remove(INSERT_TODAY);
                if (insertToday || !insertIds.isEmpty()) {
                    summaries.add(runner.runInsert(insertIds, archive));
                }
            }
        } catch (Exception e) {
            log.error("run stopped: {}", e.getMessage(), e);
            summaries.add(stoppedRun(tasks, e, clock));
        }

        for (RunSummary summary : summaries) {
            log.info(summary.getSummary());
        }
        try {
            notifyIfNeeded(bootstrap.mailProperties(), config, zone, summaries, archive);
        } catch (Exception e) {
            log.error("notification failed: {}", e.getMessage(), e);
        }
        return summaries.stream().anyMatch(RunSummary::aborted) ? 1 : 0;
    }

    /**
     * A run that never reached the reconciliation loop, recorded as a single CRITICAL issue.
     */
    static RunSummary stoppedRun(Set<String> tasks, Exception cause, Clock clock) {
        ReconcileOperation operation = tasks.isEmpty() || tasks.contains(ReconcileOperation.UPDATE.label())
                ? ReconcileOperation.UPDATE
                : ReconcileOperation.INSERT;
        RunSummary summary = new RunSummary(operation.name(), operation.label(), clock.instant());
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        summary.recordIssue(IssueSeverity.CRITICAL, "-", "run stopped: " + reason);
        summary.markAborted();
        summary.finish();
        return summary;
    }

    static Set<String> parseTasks(String raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw == null) {
            return out;
        }
        for (String token : raw.split("[,\\s]+")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private void notifyIfNeeded(MailProperties mailProps, Config config, ZoneId zone, List<RunSummary> summaries,
                                ArchiveReport archive) {
        Logger log = LogManager.getLogger(AutoReportsApplication.class);
        Mailer mailer = new Mailer(mailProps, config.workingDir(), config.getPath("outputs.dir"));
        NotificationRenderer renderer = new NotificationRenderer(zone);
        String day = DAY.format(LocalDate.now(zone));

        for (RunSummary summary : summaries) {
            if (!summary.requiresNotification()) {
                continue;
            }
            List<Path> attachments = new ArrayList<>();
            Path logFile = config.getPath("outputs.dir").resolve(mailProps.getLogFile());
            if (Files.isRegularFile(logFile)) {
                attachments.add(logFile);
            }
            String subject = String.format(Locale.ROOT, "%s errors %s (%d error, %d critical)",
                    summary.operation().toLowerCase(Locale.ROOT), day,
                    summary.issueCount(IssueSeverity.ERROR), summary.issueCount(IssueSeverity.CRITICAL));
            try {
                mailer.send(new Mailer.Notification(mailProps.getTo(), subject, summary.getSummary(),
                        renderer.renderErrorReport(summary), attachments));
            } catch (Exception e) {
                log.error("error report mail failed: {}", e.getMessage(), e);
            }
        }

        if (!archive.isEmpty()) {
            List<String> auditTo = mailProps.getAuditTo() == null || mailProps.getAuditTo().isEmpty()
                    ? mailProps.getTo()
                    : mailProps.getAuditTo();
            String subject = String.format(Locale.ROOT, "archived %d folder(s) %s", archive.moves().size(), day);
            try {
                mailer.send(new Mailer.Notification(auditTo, subject, "", renderer.renderArchiveReport(archive), List.of()));
            } catch (Exception e) {
                log.error("archive audit mail failed: {}", e.getMessage(), e);
            }
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (AutoReportsApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("autoreports.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(AutoReportsApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder()
                .longOpt("tasks")
                .hasArg()
                .argName("list")
                .desc("Comma-separated: daily_update, insert (folders created today) or task identifiers to register")
                .build());
        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Show help")
                .build());
        return options;
    }
}
