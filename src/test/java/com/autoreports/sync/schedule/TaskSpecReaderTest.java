package com.autoreports.sync.schedule;

import com.autoreports.sync.extract.EncodingDetector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskSpecReaderTest {
    private final TaskSpecReader reader = new TaskSpecReader(new EncodingDetector(Charset.forName("windows-1251"), 5000));

    @Test
    void legacySingleTriggerShape() throws TaskDefinitionException {
        TaskSpec spec = reader.parse("{\"trigger_type\": \"monthly\", \"start_date\": \"2026-10-20\", \"start_time\": \"09:00\","
                + " \"days_of_month\": [1, \"Last\"], \"months\": \"All months\", \"state\": \"disabled\","
                + " \"description\": \"Monthly digest\", \"stop_if_runs_longer\": \"2H\"}");

        assertEquals(1, spec.triggers.size());
        TriggerSpec trigger = spec.triggers.get(0);
        assertEquals("monthly", trigger.triggerType);
        assertEquals(List.of("1", "Last"), trigger.daysOfMonth);
        assertEquals(List.of("All months"), trigger.months);
        assertNull(trigger.daysOfWeek);
        assertFalse(spec.enabled);
        assertEquals("Monthly digest", spec.description);
        assertEquals("2H", spec.stopIfRunsLonger);
    }

    @Test
    void multiTriggerShapeKeepsOrder() throws TaskDefinitionException {
        TaskSpec spec = reader.parse("{\"triggers\": ["
                + "{\"trigger_type\": \"daily\", \"start_date\": \"2026-01-01\", \"start_time\": \"06:00\", \"interval\": \"2\"},"
                + "{\"trigger_type\": \"weekly\", \"start_date\": \"2026-01-01\", \"start_time\": \"07:00\", \"days_of_week\": [\"Friday\"], \"enabled\": 0}"
                + "], \"state\": true}");

        assertEquals(2, spec.triggers.size());
        assertEquals(Integer.valueOf(2), spec.triggers.get(0).interval);
        assertEquals("weekly", spec.triggers.get(1).triggerType);
        assertEquals(Boolean.FALSE, spec.triggers.get(1).enabled);
        assertEquals(Boolean.TRUE, spec.enabled);
    }

    @Test
    void malformedJsonIsReported() {
        assertThrows(TaskDefinitionException.class, () -> reader.parse("{not json"));
        assertThrows(TaskDefinitionException.class, () -> reader.parse("{\"triggers\": 5}"));
    }

    @Test
    void readsCp1251File(@TempDir Path dir) throws IOException, TaskDefinitionException {
        Path file = dir.resolve("REQ000000000001.json");
        Files.write(file, "{\"trigger_type\": \"one_time\", \"description\": \"Отчёт по продажам\"}".getBytes(Charset.forName("windows-1251")));

        TaskSpec spec = reader.read(file);

        assertEquals("Отчёт по продажам", spec.description);
    }

    @Test
    void shorthandDurationsBecomeIso() {
        assertEquals("PT2H", TaskSpecReader.toIsoDuration("2H"));
        assertEquals("P1D", TaskSpecReader.toIsoDuration("1d"));
        assertEquals("PT1H30M", TaskSpecReader.toIsoDuration("1H30M"));
        assertEquals("PT15M", TaskSpecReader.toIsoDuration("PT15M"));
        assertNull(TaskSpecReader.toIsoDuration(" "));
    }
}
