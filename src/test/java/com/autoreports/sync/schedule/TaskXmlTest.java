package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskXmlTest {
    private static final LocalDateTime START = LocalDateTime.of(2026, 10, 20, 9, 0);

    static TaskDefinition sampleDefinition() {
        List<ScheduleTrigger> triggers = List.of(
                new OneTimeTrigger(START, "2026-10-20T06:00:00Z", true, "PT1H", "PT12H"),
                new DailyTrigger(START, "2026-10-20T06:00:00Z", true, null, null, 2),
                new WeeklyTrigger(START, "2026-10-20T06:00:00Z", false, null, null, 1, 0x02 | 0x01),
                new MonthlyTrigger(START, "2026-10-20T06:00:00Z", true, null, null, 0x01 | 0x4000, true, 0x001 | 0x800)
        );
        return new TaskDefinition("REQ000000000001", Path.of("D:", "reports", "REQ000000000001", "REQ000000000001.cmd"),
                "Daily sales", triggers, true, "automation_reports", "PT2H");
    }

    @Test
    void everyTriggerKindSurvivesWriteAndParse() {
        TaskDefinition definition = sampleDefinition();

        TaskXml.ParsedTask parsed = TaskXml.parse(TaskXml.toXmlString(definition, "\\AutoReports\\REQ000000000001"));

        assertEquals("automation_reports", parsed.author);
        assertEquals("Daily sales", parsed.description);
        assertTrue(parsed.enabled);
        assertEquals(List.of(definition.executablePath.toString()), parsed.actionPaths);
        assertEquals(definition.triggers.size(), parsed.triggers.size());
        for (int i = 0; i < definition.triggers.size(); i++) {
            assertSameTrigger(definition.triggers.get(i).toRawTrigger(), parsed.triggers.get(i));
        }
    }

    @Test
    void bytesCarryUtf16LittleEndianBom() {
        byte[] bytes = TaskXml.write(sampleDefinition(), "\\AutoReports\\REQ000000000001");

        assertEquals((byte) 0xFF, bytes[0]);
        assertEquals((byte) 0xFE, bytes[1]);
        String text = new String(Arrays.copyOfRange(bytes, 2, bytes.length), StandardCharsets.UTF_16LE);
        assertTrue(text.contains("<URI>\\AutoReports\\REQ000000000001</URI>"));
        assertTrue(text.contains("<ExecutionTimeLimit>PT2H</ExecutionTimeLimit>"));
    }

    @Test
    void disabledSettingsAreRead() {
        String xml = "\uFEFF<?xml version=\"1.0\" encoding=\"UTF-16\"?>"
                + "<Task version=\"1.2\" xmlns=\"http://schemas.microsoft.com/windows/2004/02/mit/task\">"
                + "<Settings><Enabled>false</Enabled></Settings>"
                + "<Principals><Principal id=\"Author\"><UserId>svc_reports</UserId></Principal></Principals>"
                + "</Task>";

        TaskXml.ParsedTask parsed = TaskXml.parse(xml);

        assertFalse(parsed.enabled);
        assertEquals("svc_reports", parsed.userId);
        assertTrue(parsed.triggers.isEmpty());
    }

    @Test
    void garbageIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TaskXml.parse("not xml"));
    }

    private static void assertSameTrigger(RawTrigger expected, RawTrigger actual) {
        assertEquals(expected.typeCode, actual.typeCode);
        assertEquals(expected.startBoundary, actual.startBoundary);
        assertEquals(expected.enabled, actual.enabled);
        assertEquals(expected.daysInterval, actual.daysInterval);
        assertEquals(expected.weeksInterval, actual.weeksInterval);
        assertEquals(expected.daysOfWeekMask, actual.daysOfWeekMask);
        assertEquals(expected.daysOfMonthMask, actual.daysOfMonthMask);
        assertEquals(expected.runOnLastDay, actual.runOnLastDay);
        assertEquals(expected.monthsOfYearMask, actual.monthsOfYearMask);
        assertEquals(expected.repetitionInterval, actual.repetitionInterval);
        assertEquals(expected.repetitionDuration, actual.repetitionDuration);
        assertEquals(expected.stopAtDurationEnd, actual.stopAtDurationEnd);
    }
}
