package com.autoreports.sync.extract;

import com.autoreports.sync.config.Config;
import com.autoreports.sync.model.CommandFileMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模块说明：CommandFileExtractor（class）。
 * 主要职责：从作业目录中的命令文件提取发送工具、收件人、主题与目标数据库信息。
 * 使用建议：三类信息都可能缺失，缺失时返回只含任务名的结果。
 */
public final class CommandFileExtractor {
    private static final Logger log = LogManager.getLogger(CommandFileExtractor.class);

    private static final Pattern REPORT_NAME = Pattern.compile("(?i)^\\s*set\\s+\"?REPORT_NAME=(?<name>[^\"]*)\"?\\s*$");
    private static final Pattern DB_HOST = Pattern.compile("(?i)^\\s*set\\s+\"?DB_HOST=(?<host>[^\"\\s]*)\"?\\s*$");

    private final EncodingDetector encodingDetector;
    private final String filePrefix;
    private final String fileExtension;
    private final Pattern senderDirective;
    private final Map<String, String> databaseTypes;

    public CommandFileExtractor(
            EncodingDetector encodingDetector,
            String filePrefix,
            String fileExtension,
            String senderPattern,
            Map<String, String> databaseTypes
    ) {
        this.encodingDetector = encodingDetector;
        this.filePrefix = filePrefix == null ? "" : filePrefix.trim();
        this.fileExtension = fileExtension == null || fileExtension.isBlank() ? ".cmd" : fileExtension.trim();
        this.senderDirective = Pattern.compile(
                "(?i)(?<sender>" + senderPattern + ")\\s+\"(?<emails>[^|\"]*)\\|(?<subject>[^|\"]*)\\|");
        this.databaseTypes = databaseTypes == null ? Map.of() : Map.copyOf(databaseTypes);
    }

    public static CommandFileExtractor fromConfig(Config config, EncodingDetector encodingDetector) {
        return new CommandFileExtractor(
                encodingDetector,
                config.getString("command.file-prefix", ""),
                config.getString("command.file-extension", ".cmd"),
                config.getString("command.sender-pattern", "[\\w-]*sender[\\w-]*\\.exe"),
                config.getPairs("database.types")
        );
    }

    /**
     * First regular file named {@code <prefix>*<extension>}; a blank prefix means the identifier itself.
     */
    public Optional<Path> locate(Path jobDir, String identifier) throws IOException {
        if (!Files.isDirectory(jobDir)) {
            return Optional.empty();
        }
        String prefix = (filePrefix.isEmpty() ? identifier : filePrefix).toLowerCase(Locale.ROOT);
        String extension = fileExtension.toLowerCase(Locale.ROOT);
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(jobDir)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString().toLowerCase(Locale.ROOT);
                if (Files.isRegularFile(entry) && name.startsWith(prefix) && name.endsWith(extension)) {
                    matches.add(entry);
                }
            }
        }
        // directory order is platform dependent
        matches.sort(null);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * @throws IOException when the command file exists but cannot be read
     */
    public CommandFileMetadata extract(Path jobDir, String identifier) throws IOException {
        Optional<Path> commandFile = locate(jobDir, identifier);
        if (commandFile.isEmpty()) {
            log.debug("{}: no command file in {}", identifier, jobDir);
            return CommandFileMetadata.bare(identifier);
        }
        return parse(identifier, encodingDetector.readString(commandFile.get()));
    }

    public CommandFileMetadata parse(String identifier, String content) {
        String[] lines = content == null ? new String[0] : content.split("\\R");

        String sender = null;
        String emails = null;
        String subject = null;
        for (int i = lines.length - 1; i >= 0; i--) {
            Matcher m = senderDirective.matcher(lines[i]);
            if (m.find()) {
                sender = m.group("sender");
                emails = blankToNull(m.group("emails"));
                subject = blankToNull(m.group("subject"));
                break;
            }
        }

        String host = null;
        for (String line : lines) {
            Matcher name = REPORT_NAME.matcher(line);
            if (name.matches() && !name.group("name").isBlank()) {
                subject = name.group("name").trim();
            }
            Matcher db = DB_HOST.matcher(line);
            if (db.matches() && !db.group("host").isBlank()) {
                host = db.group("host").trim().toLowerCase(Locale.ROOT);
            }
        }

        return new CommandFileMetadata(
                identifier,
                sender,
                emails,
                subject,
                host,
                host == null ? null : databaseTypes.get(host)
        );
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
