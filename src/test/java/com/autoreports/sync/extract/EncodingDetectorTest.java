package com.autoreports.sync.extract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EncodingDetectorTest {
    private static final String RUSSIAN = "set REPORT_NAME=Ежедневный отчёт по продажам";

    private final EncodingDetector detector = new EncodingDetector(EncodingDetector.CP1251, 5000);

    @Test
    void asciiFallsBackToConfiguredCodePage() {
        assertEquals(EncodingDetector.CP1251, detector.detect("@echo off".getBytes(StandardCharsets.US_ASCII), true));
        Charset utf8Fallback = new EncodingDetector(StandardCharsets.UTF_8, 5000)
                .detect("@echo off".getBytes(StandardCharsets.US_ASCII), true);
        assertEquals(StandardCharsets.UTF_8, utf8Fallback);
    }

    @Test
    void utf8IsRecognized() {
        assertEquals(StandardCharsets.UTF_8, detector.detect(RUSSIAN.getBytes(StandardCharsets.UTF_8), true));
    }

    @Test
    void truncatedUtf8SampleIsStillUtf8() {
        byte[] full = RUSSIAN.getBytes(StandardCharsets.UTF_8);
        // cut inside the last two-byte letter
        byte[] cut = Arrays.copyOf(full, full.length - 1);
        assertEquals(StandardCharsets.UTF_8, detector.detect(cut, false));
    }

    @Test
    void singleByteCyrillicCodePagesAreTold() {
        assertEquals(EncodingDetector.CP1251, detector.detect(RUSSIAN.getBytes(EncodingDetector.CP1251), true));
        assertEquals(EncodingDetector.CP866, detector.detect(RUSSIAN.getBytes(EncodingDetector.CP866), true));
    }

    @Test
    void bomWinsAndIsStripped(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bom.cmd");
        byte[] body = RUSSIAN.getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);
        Files.write(file, withBom);

        assertEquals(StandardCharsets.UTF_8, detector.detect(file));
        assertEquals(RUSSIAN, detector.readString(file));
    }
}
