package com.autoreports.sync.runner;

import com.autoreports.core.IssueSeverity;
import com.autoreports.core.RunSummary;
import com.autoreports.sync.archive.ArchiveMove;
import com.autoreports.sync.archive.ArchiveMover;
import com.autoreports.sync.archive.ArchiveReport;
import com.autoreports.sync.config.Config;
import com.autoreports.sync.db.BatchWriteResult;
import com.autoreports.sync.db.RecordStore;
import com.autoreports.sync.db.RecordStoreException;
import com.autoreports.sync.extract.CommandFileExtractor;
import com.autoreports.sync.extract.EncodingDetector;
import com.autoreports.sync.extract.LogTailExtractor;
import com.autoreports.sync.merge.RecordMerger;
import com.autoreports.sync.model.CommandFileMetadata;
import com.autoreports.sync.model.DeliveryLogEvent;
import com.autoreports.sync.model.IdentifierConvention;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import com.autoreports.sync.model.TaskRuntimeInfo;
import com.autoreports.sync.schedule.ScheduleRecordNormalizer;
import com.autoreports.sync.schedule.ScheduleService;
import com.autoreports.sync.schedule.ScheduleServiceException;
import com.autoreports.sync.schedule.TaskDefinitionException;
import com.autoreports.sync.schedule.TaskSpec;
import com.autoreports.sync.schedule.TaskSpecReader;
import com.autoreports.sync.schedule.TriggerBuilder;
import com.autoreports.sync.schedule.TriggerViolation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reconciles job metadata from the scheduler, job artifacts and delivery logs into the registry.
 * Extraction runs per identifier on a fixed pool; the record store is only used from the calling thread.
 */
public final class ReconciliationRunner {
    private static final Logger log = LogManager.getLogger(ReconciliationRunner.class);

    private final RecordStore store;
    private final ScheduleService scheduleService;
    private final JobDirectoryLocator locator;
    private final IdentifierConvention convention;
    private final TaskSpecReader specReader;
    private final TriggerBuilder triggerBuilder;
    private final ScheduleRecordNormalizer scheduleNormalizer;
    private final CommandFileExtractor commandExtractor;
    private final LogTailExtractor logExtractor;
    private final ArchiveMover archiveMover;
    private final int threads;
    private final Clock clock;

    public ReconciliationRunner(
            RecordStore store,
            ScheduleService scheduleService,
            JobDirectoryLocator locator,
            IdentifierConvention convention,
            TaskSpecReader specReader,
            TriggerBuilder triggerBuilder,
            ScheduleRecordNormalizer scheduleNormalizer,
            CommandFileExtractor commandExtractor,
            LogTailExtractor logExtractor,
            ArchiveMover archiveMover,
            int threads,
            Clock clock
    ) {
        this.store = store;
        this.scheduleService = scheduleService;
        this.locator = locator;
        this.convention = convention;
        this.specReader = specReader;
        this.triggerBuilder = triggerBuilder;
        this.scheduleNormalizer = scheduleNormalizer;
        this.commandExtractor = commandExtractor;
        this.logExtractor = logExtractor;
        this.archiveMover = archiveMover;
        this.threads = Math.max(1, threads);
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public static ReconciliationRunner fromConfig(Config config, RecordStore store, ScheduleService scheduleService, Clock clock) {
        IdentifierConvention convention = new IdentifierConvention(
                config.getList("identifier.prefixes"),
                config.getInt("identifier.length", 15));
        EncodingDetector encoding = EncodingDetector.fromConfig(config);
        return new ReconciliationRunner(
                store,
                scheduleService,
                JobDirectoryLocator.fromConfig(config, convention),
                convention,
                new TaskSpecReader(encoding),
                TriggerBuilder.fromConfig(config),
                ScheduleRecordNormalizer.fromConfig(config),
                CommandFileExtractor.fromConfig(config, encoding),
                LogTailExtractor.fromConfig(config, encoding),
                ArchiveMover.fromConfig(config),
                config.getInt("reconcile.threads", 4),
                clock
        );
    }

    public RunSummary runUpdate() {
        return runUpdate(new ArchiveReport());
    }

    /**
     * Refreshes every job directory whose identifier is already registered.
     */
    public RunSummary runUpdate(ArchiveReport archive) {
        RunSummary summary = new RunSummary(ReconcileOperation.UPDATE.name(), ReconcileOperation.UPDATE.label(), clock.instant());
        try {
            summary.startStep(RunSummary.STEP_DISCOVER);
            Map<String, Path> found = locator.discover();
            summary.endStep(RunSummary.STEP_DISCOVER, 0, found.size());

            summary.startStep(RunSummary.STEP_STORE_FETCH);
            Map<String, Boolean> exists = store.existsBatch(found.keySet());
            Map<String, Path> targets = new LinkedHashMap<>();
            for (Map.Entry<String, Path> entry : found.entrySet()) {
                if (Boolean.TRUE.equals(exists.get(entry.getKey()))) {
                    targets.put(entry.getKey(), entry.getValue());
                }
            }
            summary.endStep(RunSummary.STEP_STORE_FETCH, found.size(), targets.size());
            log.info("daily update: {} job folder(s), {} registered", found.size(), targets.size());

            reconcile(targets, false, summary, archive);
        } catch (RecordStoreException | IOException e) {
            abort(summary, e);
        } finally {
            summary.finish();
        }
        return summary;
    }

    public RunSummary runInsert(Collection<String> requested) {
        return runInsert(requested, new ArchiveReport());
    }

    /**
     * Registers new jobs: the requested identifiers when given, otherwise job folders created today.
     * Identifiers already in the registry are skipped.
     */
    public RunSummary runInsert(Collection<String> requested, ArchiveReport archive) {
        RunSummary summary = new RunSummary(ReconcileOperation.INSERT.name(), ReconcileOperation.INSERT.label(), clock.instant());
        try {
            summary.startStep(RunSummary.STEP_DISCOVER);
            Map<String, Path> candidates;
            if (requested != null && !requested.isEmpty()) {
                List<String> valid = new ArrayList<>();
                for (String raw : requested) {
                    String id = raw == null ? "" : raw.trim();
                    if (convention.matches(id)) {
                        valid.add(id);
                    } else {
                        summary.recordIssue(IssueSeverity.WARNING, id, "not a valid task identifier");
                        log.warn("{}: not a valid task identifier, skipped", id);
                    }
                }
                candidates = locator.locate(valid);
                for (String id : valid) {
                    if (!candidates.containsKey(id)) {
                        summary.recordIssue(IssueSeverity.WARNING, id, "job directory not found under roots");
                        log.warn("{}: job directory not found", id);
                    }
                }
            } else {
                candidates = locator.createdOn(LocalDate.now(clock), clock.getZone());
            }
            summary.endStep(RunSummary.STEP_DISCOVER, requested == null ? 0 : requested.size(), candidates.size());

            summary.startStep(RunSummary.STEP_STORE_FETCH);
            Map<String, Boolean> exists = store.existsBatch(candidates.keySet());
            Map<String, Path> targets = new LinkedHashMap<>();
            for (Map.Entry<String, Path> entry : candidates.entrySet()) {
                if (Boolean.TRUE.equals(exists.get(entry.getKey()))) {
                    log.info("{}: already registered, skipped", entry.getKey());
                } else {
                    targets.put(entry.getKey(), entry.getValue());
                }
            }
            summary.endStep(RunSummary.STEP_STORE_FETCH, candidates.size(), targets.size());

            reconcile(targets, true, summary, archive);
        } catch (RecordStoreException | IOException e) {
            abort(summary, e);
        } finally {
            summary.finish();
        }
        return summary;
    }

    private void reconcile(Map<String, Path> targets, boolean insert, RunSummary summary, ArchiveReport archive)
            throws RecordStoreException {
        summary.setTargets(targets.size());
        if (targets.isEmpty()) {
            log.info("nothing to reconcile");
            return;
        }

        summary.startStep(RunSummary.STEP_STORE_FETCH);
        Map<String, TaskRecord> primary = store.fetchBatch(targets.keySet());
        Map<String, TaskRecord> stored = insert ? Map.of() : store.fetchStoredBatch(targets.keySet());
        summary.endStep(RunSummary.STEP_STORE_FETCH, targets.size(), primary.size() + stored.size());

        summary.startStep(RunSummary.STEP_EXTRACT);
        Map<String, Extraction> extracted = extractAll(targets, summary, archive);
        summary.endStep(RunSummary.STEP_EXTRACT, targets.size(), extracted.size());

        summary.startStep(RunSummary.STEP_MERGE);
        List<TaskRecord> merged = new ArrayList<>();
        for (String id : targets.keySet()) {
            Extraction x = extracted.getOrDefault(id, new Extraction(id));
            TaskRecord base = primary.get(id);
            if (base == null) {
                base = new TaskRecord(id);
                if (insert) {
                    log.debug("{}: no request registry entry", id);
                }
            }
            merged.addAll(RecordMerger.mergeAll(
                    List.of(base),
                    x.schedule == null ? List.of() : List.of(x.schedule),
                    x.command == null ? List.of() : List.of(x.command),
                    x.delivery == null ? List.of() : List.of(x.delivery),
                    x.archived == null ? List.of() : List.of(x.archived)));
        }
        summary.endStep(RunSummary.STEP_MERGE, targets.size(), merged.size());

        summary.startStep(RunSummary.STEP_PERSIST);
        if (insert) {
            BatchWriteResult result = store.insertBatch(merged);
            reportWrites(result, summary, "insert");
            summary.addWrites(result.writtenCount(), 0, 0, result.failedCount());
        } else {
            List<TaskRecord> deltas = new ArrayList<>();
            int unchanged = 0;
            for (TaskRecord record : merged) {
                TaskRecord delta = delta(record, stored.get(record.taskName()));
                if (delta == null) {
                    unchanged++;
                } else {
                    deltas.add(delta);
                }
            }
            BatchWriteResult result = store.updateBatch(deltas);
            reportWrites(result, summary, "update");
            summary.addWrites(0, result.writtenCount(), unchanged, result.failedCount());
        }
        summary.endStep(RunSummary.STEP_PERSIST, merged.size(), summary.inserted() + summary.updated());
        log.info("{}: inserted={} updated={} unchanged={} failed={}",
                insert ? "insert" : "update", summary.inserted(), summary.updated(), summary.unchanged(), summary.failedWrites());
    }

    /**
     * Record holding only the fields that differ from the stored row, or {@code null} when nothing changed.
     */
    static TaskRecord delta(TaskRecord merged, TaskRecord stored) {
        Map<RecordField, Object> changes = merged.changesAgainst(stored);
        if (changes.isEmpty()) {
            return null;
        }
        TaskRecord delta = new TaskRecord(merged.taskName());
        changes.forEach(delta::put);
        return delta;
    }

    private Map<String, Extraction> extractAll(Map<String, Path> targets, RunSummary summary, ArchiveReport archive) {
        Map<String, Extraction> out = new LinkedHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, targets.size()));
        CompletionService<Extraction> completion = new ExecutorCompletionService<>(pool);
        for (Map.Entry<String, Path> entry : targets.entrySet()) {
            completion.submit(() -> extractOne(entry.getKey(), entry.getValue(), summary, archive));
        }
        try {
            for (int i = 0; i < targets.size(); i++) {
                Future<Extraction> future = completion.take();
                try {
                    Extraction x = future.get();
                    out.put(x.identifier, x);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    summary.recordIssue(IssueSeverity.ERROR, "-", "extraction crashed: " + cause);
                    log.error("extraction crashed", cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            summary.recordIssue(IssueSeverity.ERROR, "-", "extraction interrupted");
            log.error("extraction interrupted after {} of {}", out.size(), targets.size());
        } finally {
            pool.shutdown();
        }
        return out;
    }

    /**
     * Gathers every source for one identifier. Failures degrade to a missing contribution.
     */
    Extraction extractOne(String id, Path jobDir, RunSummary summary, ArchiveReport archive) {
        Extraction x = new Extraction(id);
        try {
            registerDefinition(id, jobDir, summary);

            TaskRuntimeInfo info = null;
            try {
                Optional<TaskRuntimeInfo> read = scheduleService.readTask(id);
                if (read.isPresent()) {
                    info = read.get();
                    x.schedule = scheduleNormalizer.normalize(info);
                } else {
                    issue(summary, IssueSeverity.WARNING, id, "no scheduled task registered");
                }
            } catch (ScheduleServiceException e) {
                issue(summary, IssueSeverity.ERROR, id, "scheduler read failed: " + e.getMessage());
            }

            try {
                CommandFileMetadata meta = commandExtractor.extract(jobDir, id);
                x.command = meta.toRecord();
            } catch (IOException e) {
                issue(summary, IssueSeverity.WARNING, id, "command file unreadable: " + e.getMessage());
                x.command = CommandFileMetadata.bare(id).toRecord();
            }

            try {
                Optional<DeliveryLogEvent> event = logExtractor.extract(jobDir, id, LocalDate.now(clock));
                x.delivery = event.map(e -> e.toRecord(id)).orElse(null);
            } catch (IOException | RuntimeException e) {
                issue(summary, IssueSeverity.WARNING, id, "delivery log unreadable: " + e.getMessage());
            }

            if (info != null && info.isDisabled()) {
                try {
                    Optional<ArchiveMove> move = archiveMover.archiveIfDisabled(info);
                    if (move.isPresent()) {
                        archive.add(move.get());
                        x.archived = ArchiveMover.toRecord(move.get());
                    }
                } catch (IOException e) {
                    issue(summary, IssueSeverity.ERROR, id, "archive move failed: " + e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            issue(summary, IssueSeverity.ERROR, id, "unexpected extraction failure: " + e);
            log.error("{}: unexpected extraction failure", id, e);
        }
        return x;
    }

    private void registerDefinition(String id, Path jobDir, RunSummary summary) {
        Path specFile = jobDir.resolve(id + ".json");
        Path executable = jobDir.resolve(id + ".cmd");
        if (!Files.isRegularFile(specFile) || !Files.isRegularFile(executable)) {
            return;
        }
        try {
            TaskSpec spec = specReader.read(specFile);
            TriggerBuilder.Result built = triggerBuilder.build(id, executable, spec);
            for (TriggerViolation violation : built.rejected()) {
                summary.recordIssue(IssueSeverity.WARNING, id, "trigger skipped: " + violation);
            }
            if (!scheduleService.upsertTask(built.definition())) {
                issue(summary, IssueSeverity.ERROR, id, "scheduler rejected the task definition");
            }
        } catch (TaskDefinitionException e) {
            issue(summary, IssueSeverity.WARNING, id, "schedule spec invalid: " + e.getMessage());
        } catch (IOException e) {
            issue(summary, IssueSeverity.WARNING, id, "schedule spec unreadable: " + e.getMessage());
        } catch (ScheduleServiceException e) {
            issue(summary, IssueSeverity.ERROR, id, "scheduler upsert failed: " + e.getMessage());
        }
    }

    private static void reportWrites(BatchWriteResult result, RunSummary summary, String op) {
        for (Map.Entry<String, String> failure : result.failures().entrySet()) {
            summary.recordIssue(IssueSeverity.ERROR, failure.getKey(), op + " failed: " + failure.getValue());
        }
    }

    private static void issue(RunSummary summary, IssueSeverity severity, String id, String message) {
        summary.recordIssue(severity, id, message);
        log.log(severity.level(), "{}: {}", id, message);
    }

    private static void abort(RunSummary summary, Exception e) {
        summary.markAborted();
        summary.recordIssue(IssueSeverity.CRITICAL, "-", "batch aborted: " + e.getMessage());
        log.fatal("batch aborted: {}", e.getMessage(), e);
    }

    static final class Extraction {
        final String identifier;
        TaskRecord schedule;
        TaskRecord command;
        TaskRecord delivery;
        TaskRecord archived;

        Extraction(String identifier) {
            this.identifier = identifier;
        }
    }
}
