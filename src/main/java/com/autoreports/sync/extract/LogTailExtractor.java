package com.autoreports.sync.extract;

import com.autoreports.sync.config.Config;
import com.autoreports.sync.model.DeliveryLogEvent;
import com.autoreports.sync.model.DeliveryStatus;
import org.apache.commons.io.input.ReversedLinesFileReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the latest delivery event from the tail of a job's append-only log.
 * The file is read backwards in blocks and never loaded whole.
 */
public final class LogTailExtractor {
    private static final Logger log = LogManager.getLogger(LogTailExtractor.class);

    static final Pattern EVENT_LINE = Pattern.compile(
            "^(?<timestamp>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2})\\s*\\|\\s*"
                    + "(?<status>Success|Issue|SendError)\\s*"
                    + "(?:\\|\\s*(?<recipients>(?:\\[[^\\]]*\\][,;]?\\s*)*))?"
                    + "(?:\\|\\s*(?<attachments>(?:\\[[^\\]]*\\][,;]?\\s*)*))?"
                    + "(?:\\|\\s*(?<missing>(?:\\[[^\\]]*\\][,;]?\\s*)*))?"
                    + "(?:\\|\\s*(?<error>.*))?$");
    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\]]*)\\]");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final EncodingDetector encodingDetector;
    private final int blockSize;
    private final int maxLines;
    private final String placeholderAddress;

    public LogTailExtractor(EncodingDetector encodingDetector, int blockSize, int maxLines, String placeholderAddress) {
        this.encodingDetector = encodingDetector;
        this.blockSize = Math.max(512, blockSize);
        this.maxLines = Math.max(1, maxLines);
        this.placeholderAddress = placeholderAddress == null ? "" : placeholderAddress.trim().toLowerCase(Locale.ROOT);
    }

    public static LogTailExtractor fromConfig(Config config, EncodingDetector encodingDetector) {
        return new LogTailExtractor(
                encodingDetector,
                config.getInt("delivery.log.block-size", 4096),
                config.getInt("delivery.log.max-lines", 2000),
                config.getString("delivery.placeholder-address", "fake@fake.ru")
        );
    }

    /**
     * Looks for {@code log/<ID>.log} then {@code <ID>.log} inside the job directory.
     */
    public Optional<Path> locateLog(Path jobDir, String identifier) {
        List<Path> candidates = List.of(
                jobDir.resolve("log").resolve(identifier + ".log"),
                jobDir.resolve(identifier + ".log"));
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public Optional<DeliveryLogEvent> extract(Path jobDir, String identifier, LocalDate today) throws IOException {
        Optional<Path> logFile = locateLog(jobDir, identifier);
        if (logFile.isEmpty()) {
            log.debug("{}: no delivery log under {}", identifier, jobDir);
            return Optional.empty();
        }
        return extractFromFile(logFile.get(), today);
    }

    /**
     * Scans at most {@code maxLines} lines from the end. Today's newest event wins; scanning stops at the
     * first event dated before today, and the newest event seen is returned instead.
     */
    public Optional<DeliveryLogEvent> extractFromFile(Path logFile, LocalDate today) throws IOException {
        Charset charset = encodingDetector.detect(logFile);
        DeliveryLogEvent newest = null;
        try (ReversedLinesFileReader reader = ReversedLinesFileReader.builder()
                .setPath(logFile)
                .setBufferSize(blockSize)
                .setCharset(charset)
                .get()) {
            int scanned = 0;
            String line;
            while (scanned < maxLines && (line = reader.readLine()) != null) {
                scanned++;
                DeliveryLogEvent event = parseLine(line);
                if (event == null) {
                    continue;
                }
                if (newest == null) {
                    newest = event;
                }
                LocalDate day = event.timestamp.toLocalDate();
                if (day.equals(today)) {
                    return Optional.of(event);
                }
                if (day.isBefore(today)) {
                    break;
                }
            }
        }
        return Optional.ofNullable(newest);
    }

    /**
     * @return the parsed event, or {@code null} for lines that are not delivery events
     */
    DeliveryLogEvent parseLine(String rawLine) {
        if (rawLine == null) {
            return null;
        }
        String line = EncodingDetector.stripBom(rawLine).trim();
        Matcher m = EVENT_LINE.matcher(line);
        if (!m.matches()) {
            return null;
        }
        LocalDateTime timestamp;
        try {
            timestamp = LocalDateTime.parse(m.group("timestamp"), TIMESTAMP);
        } catch (DateTimeParseException e) {
            return null;
        }
        DeliveryLogEvent event = new DeliveryLogEvent(
                timestamp,
                DeliveryStatus.fromLabel(m.group("status")),
                bracketedTokens(m.group("recipients")),
                bracketedTokens(m.group("attachments")),
                bracketedTokens(m.group("missing")),
                m.group("error") == null ? "" : m.group("error").trim()
        );
        if (event.status == DeliveryStatus.SUCCESS && containsPlaceholder(event.recipients)) {
            String message = event.errorMessage.isBlank()
                    ? "recipient list contains placeholder address " + placeholderAddress
                    : event.errorMessage;
            return event.withStatus(DeliveryStatus.SEND_ERROR, message);
        }
        return event;
    }

    private boolean containsPlaceholder(List<String> recipients) {
        if (placeholderAddress.isEmpty()) {
            return false;
        }
        for (String recipient : recipients) {
            if (placeholderAddress.equals(recipient.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static List<String> bracketedTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        Matcher m = BRACKETED.matcher(raw);
        while (m.find()) {
            for (String token : m.group(1).split("[,;]")) {
                String trimmed = token.trim();
                if (!trimmed.isEmpty()) {
                    out.add(trimmed);
                }
            }
        }
        return out;
    }
}
