package com.autoreports.sync.schedule;

import com.autoreports.sync.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a declarative {@link TaskSpec} into a {@link TaskDefinition}. Invalid trigger entries are
 * reported and skipped; the definition fails only when no trigger survives.
 */
public final class TriggerBuilder {
    private static final Logger log = LogManager.getLogger(TriggerBuilder.class);

    static final DateTimeFormatter BOUNDARY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");
    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("H:mm");

    static final int DEFAULT_INTERVAL = 1;
    static final List<String> DEFAULT_DAYS_OF_WEEK = List.of("Monday");
    static final List<String> DEFAULT_DAYS_OF_MONTH = List.of("1");
    static final List<String> DEFAULT_MONTHS = List.of("January");
    static final String DEFAULT_EXECUTION_LIMIT = "PT2H";

    private final int writeOffsetHours;
    private final String owner;
    private final TriggerValidator validator;

    public TriggerBuilder(int writeOffsetHours, String owner, TriggerValidator validator) {
        this.writeOffsetHours = writeOffsetHours;
        this.owner = owner;
        this.validator = validator;
    }

    public static TriggerBuilder fromConfig(Config config) {
        return new TriggerBuilder(
                config.getInt("schedule.write-offset-hours", -3),
                config.getString("schedule.author", "automation_reports"),
                new TriggerValidator()
        );
    }

    /**
     * Built definition plus the entries that were rejected on the way.
     */
    public record Result(TaskDefinition definition, List<TriggerViolation> rejected) {
    }

    public Result build(String identifier, Path executablePath, TaskSpec spec) throws TaskDefinitionException {
        if (spec.triggers.isEmpty()) {
            throw new TaskDefinitionException(identifier + ": schedule has no triggers");
        }
        List<ScheduleTrigger> triggers = new ArrayList<>();
        List<TriggerViolation> rejected = new ArrayList<>();
        for (int i = 0; i < spec.triggers.size(); i++) {
            int index = i + 1;
            TriggerSpec resolved = withDefaults(spec.triggers.get(i));
            List<TriggerViolation> violations = validator.validate(resolved, index);
            if (!violations.isEmpty()) {
                for (TriggerViolation violation : violations) {
                    log.warn("{}: skipped {}", identifier, violation);
                }
                rejected.addAll(violations);
                continue;
            }
            triggers.add(buildTrigger(resolved));
        }
        if (triggers.isEmpty()) {
            throw new TaskDefinitionException(identifier + ": no valid trigger, rejected " + rejected);
        }

        String limit = TaskSpecReader.toIsoDuration(spec.stopIfRunsLonger);
        TaskDefinition definition = new TaskDefinition(
                identifier,
                executablePath,
                spec.description,
                triggers,
                spec.enabled == null || spec.enabled,
                owner,
                limit == null ? DEFAULT_EXECUTION_LIMIT : limit
        );
        return new Result(definition, rejected);
    }

    /**
     * Fills absent optional fields from the defaults table. Explicit empty lists are kept.
     */
    public static TriggerSpec withDefaults(TriggerSpec spec) {
        return spec.toBuilder()
                .interval(spec.interval == null ? DEFAULT_INTERVAL : spec.interval)
                .daysOfWeek(spec.daysOfWeek == null ? DEFAULT_DAYS_OF_WEEK : spec.daysOfWeek)
                .daysOfMonth(spec.daysOfMonth == null ? DEFAULT_DAYS_OF_MONTH : spec.daysOfMonth)
                .months(spec.months == null ? DEFAULT_MONTHS : spec.months)
                .enabled(spec.enabled == null ? Boolean.TRUE : spec.enabled)
                .build();
    }

    /**
     * Builds the native trigger for an already defaulted and validated entry.
     */
    ScheduleTrigger buildTrigger(TriggerSpec spec) {
        LocalDateTime localStart = LocalDateTime.of(
                LocalDate.parse(spec.startDate),
                LocalTime.parse(spec.startTime, HOUR_MINUTE));
        String boundary = startBoundary(localStart);
        boolean enabled = spec.enabled == null || spec.enabled;
        String repeatEvery = TaskSpecReader.toIsoDuration(spec.repeatEvery);
        String repeatDuration = TaskSpecReader.toIsoDuration(spec.repeatDuration);

        TriggerType type = TriggerType.fromText(spec.triggerType);
        switch (type) {
            case ONE_TIME:
                return new OneTimeTrigger(localStart, boundary, enabled, repeatEvery, repeatDuration);
            case DAILY:
                return new DailyTrigger(localStart, boundary, enabled, repeatEvery, repeatDuration, spec.interval);
            case WEEKLY:
                return new WeeklyTrigger(localStart, boundary, enabled, repeatEvery, repeatDuration,
                        spec.interval, weekdayMask(spec.daysOfWeek));
            case MONTHLY:
                boolean lastDay = spec.daysOfMonth.stream().anyMatch(CalendarNames::isLastDay);
                boolean allMonths = spec.months.stream().anyMatch(CalendarNames::isAllMonths);
                return new MonthlyTrigger(localStart, boundary, enabled, repeatEvery, repeatDuration,
                        monthDayMask(spec.daysOfMonth),
                        lastDay,
                        allMonths ? BitmaskSetCodec.encode(allOrdinals(12), BitmaskField.MONTH) : monthMask(spec.months));
            default:
                throw new IllegalArgumentException("unsupported trigger type: " + type);
        }
    }

    public String startBoundary(LocalDateTime localStart) {
        return localStart.plusHours(writeOffsetHours).format(BOUNDARY_FORMAT);
    }

    private static int weekdayMask(List<String> names) {
        Set<Integer> ordinals = new LinkedHashSet<>();
        for (String name : names) {
            ordinals.add(CalendarNames.weekdayOrdinal(name));
        }
        return BitmaskSetCodec.encode(ordinals, BitmaskField.WEEKDAY);
    }

    private static int monthDayMask(List<String> days) {
        Set<Integer> ordinals = new LinkedHashSet<>();
        for (String day : days) {
            if (!CalendarNames.isLastDay(day)) {
                ordinals.add(Integer.parseInt(day.trim()));
            }
        }
        return BitmaskSetCodec.encode(ordinals, BitmaskField.MONTH_DAY);
    }

    private static int monthMask(List<String> names) {
        Set<Integer> ordinals = new LinkedHashSet<>();
        for (String name : names) {
            if (!CalendarNames.isAllMonths(name)) {
                ordinals.add(CalendarNames.monthOrdinal(name));
            }
        }
        return BitmaskSetCodec.encode(ordinals, BitmaskField.MONTH);
    }

    private static Set<Integer> allOrdinals(int max) {
        Set<Integer> out = new LinkedHashSet<>();
        for (int i = 1; i <= max; i++) {
            out.add(i);
        }
        return out;
    }
}
