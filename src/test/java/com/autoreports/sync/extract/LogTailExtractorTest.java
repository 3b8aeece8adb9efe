package com.autoreports.sync.extract;

import com.autoreports.sync.model.DeliveryLogEvent;
import com.autoreports.sync.model.DeliveryStatus;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogTailExtractorTest {
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private final LogTailExtractor extractor =
            new LogTailExtractor(new EncodingDetector(EncodingDetector.CP1251, 5000), 4096, 2000, "fake@fake.ru");

    @Test
    void todaysNewestEventWins(@TempDir Path jobDir) throws IOException {
        writeLog(jobDir.resolve("log"), "REQ000000000001",
                "2026-10-18 10:00:00 | Success | [old@x.com] | [old.xlsx] | [] |",
                "2026-10-19 08:00:00 | Success | [a@x.com] | [morning.xlsx] | [] |",
                "2026-10-19 09:00:05 | Issue | [a@x.com, b@x.com] | [r.xlsx] | [missing.pdf] | attachment missing",
                "sending finished");

        Optional<DeliveryLogEvent> event = extractor.extract(jobDir, "REQ000000000001", TODAY);

        assertTrue(event.isPresent());
        assertEquals(LocalDateTime.of(2026, 10, 19, 9, 0, 5), event.get().timestamp);
        assertEquals(DeliveryStatus.ISSUE, event.get().status);
        assertEquals(List.of("a@x.com", "b@x.com"), event.get().recipients);
        assertEquals(List.of("missing.pdf"), event.get().missingAttachments);
        assertEquals("attachment missing", event.get().errorMessage);
    }

    @Test
    void olderEventIsReturnedWhenNothingToday(@TempDir Path jobDir) throws IOException {
        writeLog(jobDir, "REQ000000000001",
                "2026-10-10 10:00:00 | SendError | [a@x.com] | [] | [] | smtp timeout",
                "2026-10-17 10:00:00 | Success | [a@x.com] | [r.xlsx] | [] |");

        DeliveryLogEvent event = extractor.extract(jobDir, "REQ000000000001", TODAY).orElseThrow();

        assertEquals(LocalDateTime.of(2026, 10, 17, 10, 0), event.timestamp);
        assertEquals(DeliveryStatus.SUCCESS, event.status);
    }

    @Test
    void placeholderRecipientDowngradesSuccess() {
        DeliveryLogEvent event = extractor.parseLine("2026-10-19 09:00:05 | Success | [FAKE@fake.ru; a@x.com] | [r.xlsx] | [] |");

        assertEquals(DeliveryStatus.SEND_ERROR, event.status);
        assertTrue(event.errorMessage.contains("fake@fake.ru"));

        TaskRecord record = event.toRecord("REQ000000000001");
        assertEquals("SendError", record.get(RecordField.DELIVERY_STATUS));
        assertEquals("FAKE@fake.ru;a@x.com", record.get(RecordField.DELIVERY_RECIPIENTS));
        assertNull(record.get(RecordField.DELIVERY_MISSING_ATTACHMENTS));
    }

    @Test
    void nonEventLinesAreIgnored() {
        assertNull(extractor.parseLine("mail_sender.exe started"));
        assertNull(extractor.parseLine("2026-13-45 10:00:00 | Success"));
    }

    @Test
    void scanIsBoundedByMaxLines(@TempDir Path jobDir) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("2026-10-19 07:00:00 | Success | [a@x.com] | [] | [] |");
        for (int i = 0; i < 50; i++) {
            lines.add("noise line " + i);
        }
        writeLog(jobDir, "REQ000000000001", lines.toArray(new String[0]));
        LogTailExtractor bounded = new LogTailExtractor(new EncodingDetector(EncodingDetector.CP1251, 5000), 512, 10, "");

        assertTrue(bounded.extract(jobDir, "REQ000000000001", TODAY).isEmpty());
        assertTrue(extractor.extract(jobDir, "REQ000000000001", TODAY).isPresent());
    }

    @Test
    void missingLogYieldsNothing(@TempDir Path jobDir) throws IOException {
        assertTrue(extractor.extract(jobDir, "REQ000000000001", TODAY).isEmpty());
    }

    private static void writeLog(Path dir, String id, String... lines) throws IOException {
        Files.createDirectories(dir);
        Files.write(dir.resolve(id + ".log"), String.join("\r\n", lines).concat("\r\n").getBytes(StandardCharsets.UTF_8));
    }
}
