package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Task Scheduler XML (schema 1.2): writes registration documents and reads {@code schtasks /Query /XML} output.
 */
public final class TaskXml {
    static final String NAMESPACE = "http://schemas.microsoft.com/windows/2004/02/mit/task";

    // schema order of the day elements inside DaysOfWeek
    private static final String[] WEEKDAY_ELEMENTS = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    private TaskXml() {
    }

    /**
     * Parsed registration document. Runtime state is not part of it.
     */
    public static final class ParsedTask {
        public final String author;
        public final String description;
        public final String userId;
        public final boolean enabled;
        public final List<String> actionPaths;
        public final List<RawTrigger> triggers;

        ParsedTask(String author, String description, String userId, boolean enabled,
                   List<String> actionPaths, List<RawTrigger> triggers) {
            this.author = author;
            this.description = description;
            this.userId = userId;
            this.enabled = enabled;
            this.actionPaths = List.copyOf(actionPaths);
            this.triggers = List.copyOf(triggers);
        }
    }

    /**
     * Serializes the definition as UTF-16LE with a byte-order mark, the encoding {@code schtasks /XML} expects.
     */
    public static byte[] write(TaskDefinition definition, String taskPath) {
        String xml = toXmlString(definition, taskPath);
        byte[] body = xml.getBytes(StandardCharsets.UTF_16LE);
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length + 2);
        out.write(0xFF);
        out.write(0xFE);
        out.write(body, 0, body.length);
        return out.toByteArray();
    }

    static String toXmlString(TaskDefinition definition, String taskPath) {
        try {
            Document doc = newFactory().newDocumentBuilder().newDocument();
            Element task = doc.createElementNS(NAMESPACE, "Task");
            task.setAttribute("version", "1.2");
            doc.appendChild(task);

            Element registration = child(doc, task, "RegistrationInfo");
            textChild(doc, registration, "Author", definition.owner);
            textChild(doc, registration, "Description", definition.description);
            textChild(doc, registration, "URI", taskPath);

            Element triggers = child(doc, task, "Triggers");
            for (ScheduleTrigger trigger : definition.triggers) {
                writeTrigger(doc, triggers, trigger);
            }

            Element principal = child(doc, child(doc, task, "Principals"), "Principal");
            principal.setAttribute("id", "Author");
            textChild(doc, principal, "LogonType", "S4U");
            textChild(doc, principal, "RunLevel", "LeastPrivilege");

            Element settings = child(doc, task, "Settings");
            textChild(doc, settings, "MultipleInstancesPolicy", "IgnoreNew");
            textChild(doc, settings, "StartWhenAvailable", "true");
            textChild(doc, settings, "Enabled", String.valueOf(definition.enabled));
            textChild(doc, settings, "ExecutionTimeLimit", definition.executionTimeLimit);

            Element actions = child(doc, task, "Actions");
            actions.setAttribute("Context", "Author");
            Element exec = child(doc, actions, "Exec");
            textChild(doc, exec, "Command", definition.executablePath == null ? null : definition.executablePath.toString());
            if (definition.executablePath != null && definition.executablePath.getParent() != null) {
                textChild(doc, exec, "WorkingDirectory", definition.executablePath.getParent().toString());
            }

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-16");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("failed to build task xml for " + definition.identifier, e);
        }
    }

    private static void writeTrigger(Document doc, Element parent, ScheduleTrigger trigger) {
        boolean calendar = trigger.type() != TriggerType.ONE_TIME;
        Element element = child(doc, parent, calendar ? "CalendarTrigger" : "TimeTrigger");
        if (trigger.hasRepetition()) {
            Element repetition = child(doc, element, "Repetition");
            textChild(doc, repetition, "Interval", trigger.repetitionInterval);
            textChild(doc, repetition, "Duration", trigger.repetitionDuration);
            textChild(doc, repetition, "StopAtDurationEnd", "false");
        }
        textChild(doc, element, "StartBoundary", trigger.startBoundary);
        textChild(doc, element, "Enabled", String.valueOf(trigger.enabled));

        if (trigger instanceof DailyTrigger daily) {
            textChild(doc, child(doc, element, "ScheduleByDay"), "DaysInterval", String.valueOf(daily.daysInterval));
        } else if (trigger instanceof WeeklyTrigger weekly) {
            Element byWeek = child(doc, element, "ScheduleByWeek");
            Element days = child(doc, byWeek, "DaysOfWeek");
            Set<Integer> selected = BitmaskSetCodec.decode(weekly.daysOfWeekMask, BitmaskField.WEEKDAY);
            for (String dayName : WEEKDAY_ELEMENTS) {
                if (selected.contains(CalendarNames.weekdayOrdinal(dayName))) {
                    child(doc, days, dayName);
                }
            }
            textChild(doc, byWeek, "WeeksInterval", String.valueOf(weekly.weeksInterval));
        } else if (trigger instanceof MonthlyTrigger monthly) {
            Element byMonth = child(doc, element, "ScheduleByMonth");
            Element days = child(doc, byMonth, "DaysOfMonth");
            for (int ordinal : BitmaskSetCodec.decode(monthly.daysOfMonthMask, BitmaskField.MONTH_DAY)) {
                if (ordinal != 0) {
                    textChild(doc, days, "Day", String.valueOf(ordinal));
                }
            }
            if (monthly.runOnLastDay) {
                textChild(doc, days, "Day", CalendarNames.LAST_DAY);
            }
            Element months = child(doc, byMonth, "Months");
            for (int ordinal : BitmaskSetCodec.decode(monthly.monthsOfYearMask, BitmaskField.MONTH)) {
                child(doc, months, CalendarNames.monthName(ordinal));
            }
        }
    }

    public static ParsedTask parse(String xml) {
        Document doc;
        try {
            doc = newFactory().newDocumentBuilder().parse(new InputSource(new StringReader(stripProlog(xml))));
        } catch (Exception e) {
            throw new IllegalArgumentException("unreadable task xml: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        Element registration = firstChild(root, "RegistrationInfo");
        Element settings = firstChild(root, "Settings");
        Element principals = firstChild(root, "Principals");
        Element principal = principals == null ? null : firstChild(principals, "Principal");

        List<String> actions = new ArrayList<>();
        Element actionsElement = firstChild(root, "Actions");
        if (actionsElement != null) {
            for (Element exec : children(actionsElement, "Exec")) {
                String command = childText(exec, "Command");
                if (command != null) {
                    actions.add(command);
                }
            }
        }

        List<RawTrigger> triggers = new ArrayList<>();
        Element triggersElement = firstChild(root, "Triggers");
        if (triggersElement != null) {
            for (Element trigger : children(triggersElement, null)) {
                RawTrigger raw = readTrigger(trigger);
                if (raw != null) {
                    triggers.add(raw);
                }
            }
        }

        String enabledText = settings == null ? null : childText(settings, "Enabled");
        return new ParsedTask(
                registration == null ? null : childText(registration, "Author"),
                registration == null ? null : childText(registration, "Description"),
                principal == null ? null : childText(principal, "UserId"),
                enabledText == null || Boolean.parseBoolean(enabledText),
                actions,
                triggers
        );
    }

    private static RawTrigger readTrigger(Element trigger) {
        String name = localName(trigger);
        RawTrigger.RawTriggerBuilder builder = RawTrigger.builder()
                .startBoundary(childText(trigger, "StartBoundary"));
        String enabled = childText(trigger, "Enabled");
        builder.enabled(enabled == null || Boolean.parseBoolean(enabled));

        Element repetition = firstChild(trigger, "Repetition");
        if (repetition != null) {
            String stop = childText(repetition, "StopAtDurationEnd");
            builder.repetitionInterval(childText(repetition, "Interval"))
                    .repetitionDuration(childText(repetition, "Duration"))
                    .stopAtDurationEnd(stop != null && Boolean.parseBoolean(stop));
        }

        if ("TimeTrigger".equals(name)) {
            return builder.typeCode(TriggerType.ONE_TIME.code()).build();
        }
        if (!"CalendarTrigger".equals(name)) {
            return null;
        }

        Element byDay = firstChild(trigger, "ScheduleByDay");
        if (byDay != null) {
            return builder.typeCode(TriggerType.DAILY.code())
                    .daysInterval(parseIntOr(childText(byDay, "DaysInterval"), 1))
                    .build();
        }
        Element byWeek = firstChild(trigger, "ScheduleByWeek");
        if (byWeek != null) {
            List<Integer> days = new ArrayList<>();
            Element daysElement = firstChild(byWeek, "DaysOfWeek");
            if (daysElement != null) {
                for (Element day : children(daysElement, null)) {
                    int ordinal = CalendarNames.weekdayOrdinal(localName(day));
                    if (ordinal > 0) {
                        days.add(ordinal);
                    }
                }
            }
            return builder.typeCode(TriggerType.WEEKLY.code())
                    .weeksInterval(parseIntOr(childText(byWeek, "WeeksInterval"), 1))
                    .daysOfWeekMask(BitmaskSetCodec.encode(days, BitmaskField.WEEKDAY))
                    .build();
        }
        Element byMonth = firstChild(trigger, "ScheduleByMonth");
        if (byMonth != null) {
            List<Integer> days = new ArrayList<>();
            boolean lastDay = false;
            Element daysElement = firstChild(byMonth, "DaysOfMonth");
            if (daysElement != null) {
                for (Element day : children(daysElement, "Day")) {
                    String text = day.getTextContent() == null ? "" : day.getTextContent().trim();
                    if (CalendarNames.isLastDay(text)) {
                        lastDay = true;
                    } else {
                        days.add(parseIntOr(text, 0));
                    }
                }
            }
            List<Integer> months = new ArrayList<>();
            Element monthsElement = firstChild(byMonth, "Months");
            if (monthsElement != null) {
                for (Element month : children(monthsElement, null)) {
                    int ordinal = CalendarNames.monthOrdinal(localName(month));
                    if (ordinal > 0) {
                        months.add(ordinal);
                    }
                }
            }
            return builder.typeCode(TriggerType.MONTHLY.code())
                    .daysOfMonthMask(BitmaskSetCodec.encode(days, BitmaskField.MONTH_DAY))
                    .runOnLastDay(lastDay)
                    .monthsOfYearMask(BitmaskSetCodec.encode(months, BitmaskField.MONTH))
                    .build();
        }
        // calendar trigger kinds this registry never creates (day-of-week-in-month)
        return builder.build();
    }

    private static DocumentBuilderFactory newFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException ignored) {
            // parser without the feature; entity expansion is already off
        }
        return factory;
    }

    private static String stripProlog(String xml) {
        String text = xml == null ? "" : xml.trim();
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        // the declared UTF-16 encoding is wrong once the text is already decoded
        if (text.startsWith("<?xml")) {
            int end = text.indexOf("?>");
            if (end > 0) {
                text = text.substring(end + 2).trim();
            }
        }
        return text;
    }

    private static Element child(Document doc, Element parent, String name) {
        Element element = doc.createElementNS(NAMESPACE, name);
        parent.appendChild(element);
        return element;
    }

    private static void textChild(Document doc, Element parent, String name, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        child(doc, parent, name).setTextContent(value);
    }

    private static String localName(Node node) {
        String local = node.getLocalName();
        return local == null ? node.getNodeName() : local;
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && (name == null || name.equals(localName(node)))) {
                out.add((Element) node);
            }
        }
        return out;
    }

    private static Element firstChild(Element parent, String name) {
        List<Element> found = children(parent, name);
        return found.isEmpty() ? null : found.get(0);
    }

    private static String childText(Element parent, String name) {
        Element element = firstChild(parent, name);
        if (element == null || element.getTextContent() == null) {
            return null;
        }
        String text = element.getTextContent().trim();
        return text.isEmpty() ? null : text;
    }

    private static int parseIntOr(String raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim().toLowerCase(Locale.ROOT));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
