package com.autoreports.sync.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并三层配置（内置默认值 → classpath 的 config.properties → 工作目录下的 config.properties）。
 * 使用建议：空白值视为未设置并回退到下一层；类型化视图通过 {@link #asMap()} 交给 Binder。
 */
public final class Config {
    static final String FILE_NAME = "config.properties";
    static final String LAYER_RESOURCE = "resource";
    static final String LAYER_OVERRIDE = "override";
    static final String LAYER_DEFAULT = "default";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Path workingDir;
    // later layers win
    private final Map<String, Properties> layers = new LinkedHashMap<>();

    private Config(Path workingDir) {
        this.workingDir = workingDir;
        layers.put(LAYER_RESOURCE, new Properties());
        layers.put(LAYER_OVERRIDE, new Properties());
    }

    /**
     * @throws IllegalStateException when a config file exists but cannot be read
     */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.layers.get(LAYER_RESOURCE).load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IllegalStateException("classpath " + FILE_NAME + " is unreadable: " + e.getMessage(), e);
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.isRegularFile(local)) {
            try (Reader reader = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                config.layers.get(LAYER_OVERRIDE).load(reader);
            } catch (IOException e) {
                throw new IllegalStateException(local + " is unreadable: " + e.getMessage(), e);
            }
        }
        return config;
    }

    /**
     * Builds a config whose override layer is {@code rawProperties}; no file is read.
     */
    public static Config fromProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        Properties override = config.layers.get(LAYER_OVERRIDE);
        if (rawProperties != null) {
            rawProperties.forEach((key, value) -> {
                if (key != null && !key.isBlank()) {
                    override.setProperty(key.trim(), value == null ? "" : String.valueOf(value));
                }
            });
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    /**
     * 方法说明：getString，按层级从后往前取第一个非空白值，全部为空时回退到默认表。
     */
    public String getString(String key) {
        String value = explicitValue(key);
        return value != null ? value : DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public long getLong(String key, long fallback) {
        try {
            return Long.parseLong(getString(key));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * 方法说明：getPath，负责获取数据并返回结果。
     * 处理流程：相对路径基于工作目录解析。
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public List<Path> getPathList(String key) {
        List<Path> out = new ArrayList<>();
        for (String raw : getList(key)) {
            out.add(workingDir.resolve(raw).normalize());
        }
        return out;
    }

    /**
     * Reads a {@code key:value} list such as {@code oradb01:Oracle,pgsrv01:PostgreSQL}.
     * Keys are lower-cased; entries without a colon are skipped.
     */
    public Map<String, String> getPairs(String key) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String token : getList(key)) {
            int colon = token.indexOf(':');
            if (colon <= 0 || colon == token.length() - 1) {
                continue;
            }
            out.put(token.substring(0, colon).trim().toLowerCase(Locale.ROOT), token.substring(colon + 1).trim());
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Effective key/value view (defaults overlaid by every layer), for typed binding.
     */
    public Map<String, String> asMap() {
        Map<String, String> out = new HashMap<>(DEFAULTS);
        for (Properties layer : layers.values()) {
            for (String name : layer.stringPropertyNames()) {
                String value = nonBlank(layer.getProperty(name));
                if (value != null) {
                    out.put(name, value);
                }
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Name of the layer that supplies {@code key}: {@code override}, {@code resource} or {@code default}.
     */
    public String sourceOf(String key) {
        if (key == null || key.isBlank()) {
            return LAYER_DEFAULT;
        }
        List<String> names = new ArrayList<>(layers.keySet());
        Collections.reverse(names);
        for (String name : names) {
            if (nonBlank(layers.get(name).getProperty(key)) != null) {
                return name;
            }
        }
        return LAYER_DEFAULT;
    }

    private String explicitValue(String key) {
        List<Properties> ordered = new ArrayList<>(layers.values());
        Collections.reverse(ordered);
        for (Properties layer : ordered) {
            String value = nonBlank(layer.getProperty(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String nonBlank(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "Europe/Moscow");

        defaults.put("db.url", "jdbc:postgresql://localhost:5432/autoreports");
        defaults.put("db.user", "autoreports");
        defaults.put("db.pass", "autoreports");
        defaults.put("db.schema", "autoreports");
        defaults.put("db.connect-timeout-seconds", "10");
        defaults.put("db.sql-log.enabled", "true");

        defaults.put("roots", "reports");
        defaults.put("roots.ignored", "!example,archive,log,old,.git");
        defaults.put("identifier.prefixes", "REQ,RA");
        defaults.put("identifier.length", "15");
        defaults.put("reconcile.threads", "4");

        defaults.put("schedule.folder", "\\AutoReports");
        defaults.put("schedule.author", "automation_reports");
        defaults.put("schedule.write-offset-hours", "-3");
        defaults.put("schedule.read-offset-hours", "-1");
        defaults.put("schedule.console-charset", "IBM866");
        defaults.put("schedule.domain-prefix", "domain_name\\");
        defaults.put("schedule.command-timeout-seconds", "60");

        defaults.put("command.file-prefix", "");
        defaults.put("command.file-extension", ".cmd");
        defaults.put("command.sender-pattern", "[\\w-]*sender[\\w-]*\\.exe");
        defaults.put("database.types", "");
        defaults.put("encoding.fallback", "windows-1251");
        defaults.put("encoding.sniff-bytes", "5000");

        defaults.put("delivery.log.block-size", "4096");
        defaults.put("delivery.log.max-lines", "2000");
        defaults.put("delivery.placeholder-address", "fake@fake.ru");

        defaults.put("archive.folder-name", "Archive");

        defaults.put("mail.enabled", "false");
        defaults.put("mail.smtp-host", "localhost");
        defaults.put("mail.smtp-port", "25");
        defaults.put("mail.subject-prefix", "[AutoReports]");
        defaults.put("mail.dry-run", "false");
        defaults.put("mail.fail-fast", "false");
        defaults.put("mail.log-file", "log/autoreports.log");

        return Collections.unmodifiableMap(defaults);
    }
}
