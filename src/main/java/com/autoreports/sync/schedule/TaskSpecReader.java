package com.autoreports.sync.schedule;

import com.autoreports.sync.extract.EncodingDetector;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the declarative {@code <ID>.json} schedule file. Two shapes are accepted:
 * a legacy single-trigger object, or {@code {"triggers": [...]}} with task-level keys alongside.
 */
public final class TaskSpecReader {
    private static final Pattern SHORT_DURATION = Pattern.compile("(?i)^(?:(\\d+)D)?(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?$");

    private final EncodingDetector encodingDetector;

    public TaskSpecReader(EncodingDetector encodingDetector) {
        this.encodingDetector = encodingDetector;
    }

    public TaskSpec read(Path specFile) throws IOException, TaskDefinitionException {
        String content = encodingDetector.readString(specFile);
        try {
            return parse(content);
        } catch (TaskDefinitionException e) {
            throw new TaskDefinitionException(specFile.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public TaskSpec parse(String content) throws TaskDefinitionException {
        JSONObject root;
        try {
            root = new JSONObject(content == null ? "" : content);
        } catch (JSONException e) {
            throw new TaskDefinitionException("malformed schedule json: " + e.getMessage(), e);
        }

        List<TriggerSpec> triggers = new ArrayList<>();
        if (root.has("triggers")) {
            JSONArray arr = root.optJSONArray("triggers");
            if (arr == null) {
                throw new TaskDefinitionException("\"triggers\" must be a list");
            }
            for (int i = 0; i < arr.length(); i++) {
                JSONObject item = arr.optJSONObject(i);
                // non-object entries become empty specs so the validator reports them by index
                triggers.add(item == null ? TriggerSpec.builder().build() : parseTrigger(item));
            }
        } else {
            triggers.add(parseTrigger(root));
        }

        return new TaskSpec(
                triggers,
                textOrNull(root, "description"),
                parseState(root.opt("state")),
                textOrNull(root, "stop_if_runs_longer")
        );
    }

    private TriggerSpec parseTrigger(JSONObject item) {
        return TriggerSpec.builder()
                .triggerType(textOrNull(item, "trigger_type"))
                .startDate(textOrNull(item, "start_date"))
                .startTime(textOrNull(item, "start_time"))
                .interval(intOrNull(item.opt("interval")))
                .daysOfWeek(listOrNull(item.opt("days_of_week")))
                .daysOfMonth(listOrNull(item.opt("days_of_month")))
                .months(listOrNull(item.opt("months")))
                .repeatEvery(textOrNull(item, "repeat_every"))
                .repeatDuration(textOrNull(item, "repeat_duration"))
                .enabled(item.has("enabled") && !item.isNull("enabled") ? parseState(item.opt("enabled")) : null)
                .build();
    }

    /**
     * Converts shorthand like {@code 2H}, {@code 30M} or {@code 1D} to ISO-8601; ISO input passes through.
     * Returns {@code null} for blank input.
     */
    public static String toIsoDuration(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.startsWith("P")) {
            return value;
        }
        Matcher m = SHORT_DURATION.matcher(value);
        if (!m.matches()) {
            return value;
        }
        StringBuilder out = new StringBuilder("P");
        if (m.group(1) != null) {
            out.append(m.group(1)).append('D');
        }
        if (m.group(2) != null || m.group(3) != null || m.group(4) != null) {
            out.append('T');
            if (m.group(2) != null) {
                out.append(m.group(2)).append('H');
            }
            if (m.group(3) != null) {
                out.append(m.group(3)).append('M');
            }
            if (m.group(4) != null) {
                out.append(m.group(4)).append('S');
            }
        }
        return out.toString();
    }

    private static String textOrNull(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        String value = String.valueOf(obj.get(key)).trim();
        return value.isEmpty() ? null : value;
    }

    private static Integer intOrNull(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> listOrNull(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return null;
        }
        List<String> out = new ArrayList<>();
        if (raw instanceof JSONArray arr) {
            for (int i = 0; i < arr.length(); i++) {
                Object item = arr.opt(i);
                if (item != null && !JSONObject.NULL.equals(item)) {
                    out.add(String.valueOf(item).trim());
                }
            }
            return out;
        }
        String text = String.valueOf(raw).trim();
        if (!text.isEmpty()) {
            out.add(text);
        }
        return out;
    }

    private static Boolean parseState(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return null;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof Number n) {
            return n.intValue() != 0;
        }
        String text = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "true":
            case "enabled":
            case "on":
            case "yes":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "disabled":
            case "off":
            case "no":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
