package com.autoreports.sync.output;

import com.autoreports.core.IssueSeverity;
import com.autoreports.core.RunSummary;
import com.autoreports.sync.archive.ArchiveMove;
import com.autoreports.sync.archive.ArchiveReport;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders notification HTML using Thymeleaf templates from classpath.
 */
public final class NotificationRenderer {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TemplateEngine templateEngine;
    private final ZoneId zone;

    public NotificationRenderer(ZoneId zone) {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public String renderErrorReport(RunSummary summary) {
        List<Map<String, Object>> issues = new ArrayList<>();
        for (RunSummary.Issue issue : summary.issues()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("severity", issue.severity().name());
            row.put("identifier", issue.identifier());
            row.put("message", issue.message());
            row.put("at", STAMP.format(issue.at().atZone(zone)));
            issues.add(row);
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("operation", summary.operation());
        variables.put("startedAt", STAMP.format(summary.startedAt().atZone(zone)));
        variables.put("aborted", summary.aborted());
        variables.put("targets", summary.targets());
        variables.put("inserted", summary.inserted());
        variables.put("updated", summary.updated());
        variables.put("failedWrites", summary.failedWrites());
        variables.put("warningCount", summary.issueCount(IssueSeverity.WARNING));
        variables.put("errorCount", summary.issueCount(IssueSeverity.ERROR));
        variables.put("criticalCount", summary.issueCount(IssueSeverity.CRITICAL));
        variables.put("issues", issues);
        return render("notify/error_report", variables);
    }

    public String renderArchiveReport(ArchiveReport report) {
        List<Map<String, Object>> groups = new ArrayList<>();
        for (Map.Entry<Path, List<ArchiveMove>> entry : report.groupedByParent().entrySet()) {
            List<Map<String, Object>> moves = new ArrayList<>();
            for (ArchiveMove move : entry.getValue()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("identifier", move.identifier());
                row.put("source", move.source().toString());
                row.put("target", move.target().toString());
                row.put("merged", move.merged());
                moves.add(row);
            }
            Map<String, Object> group = new LinkedHashMap<>();
            group.put("parent", entry.getKey().toString());
            group.put("moves", moves);
            groups.add(group);
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("groups", groups);
        variables.put("total", report.moves().size());
        return render("notify/archive_report", variables);
    }

    private String render(String template, Map<String, Object> variables) {
        Context context = new Context(Locale.ROOT);
        variables.forEach(context::setVariable);
        return templateEngine.process(template, context);
    }
}
