package com.autoreports.sync.runner;

import com.autoreports.sync.config.Config;
import com.autoreports.sync.model.IdentifierConvention;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds job directories (folders named after a task identifier) under the configured roots.
 * Ignored folder names are never descended into; matching is case-insensitive.
 */
public final class JobDirectoryLocator {
    private static final Logger log = LogManager.getLogger(JobDirectoryLocator.class);

    private final List<Path> roots;
    private final Set<String> ignored;
    private final IdentifierConvention convention;

    public JobDirectoryLocator(List<Path> roots, Collection<String> ignored, IdentifierConvention convention) {
        this.roots = roots == null ? List.of() : List.copyOf(roots);
        this.ignored = new HashSet<>();
        if (ignored != null) {
            for (String name : ignored) {
                if (name != null && !name.isBlank()) {
                    this.ignored.add(name.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.convention = convention;
    }

    public static JobDirectoryLocator fromConfig(Config config, IdentifierConvention convention) {
        List<String> ignored = new ArrayList<>(config.getList("roots.ignored"));
        ignored.add(config.getString("archive.folder-name", "Archive"));
        return new JobDirectoryLocator(config.getPathList("roots"), ignored, convention);
    }

    /**
     * @return identifier to job directory, in identifier order; the first directory found wins on duplicates
     */
    public Map<String, Path> discover() throws IOException {
        Map<String, Path> out = new TreeMap<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                log.warn("root is not a directory, skipped: {}", root);
                continue;
            }
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    if (ignored.contains(name.toLowerCase(Locale.ROOT))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (convention.matches(name)) {
                        Path previous = out.putIfAbsent(name, dir);
                        if (previous != null) {
                            log.warn("{}: duplicate job directory {} ignored, using {}", name, dir, previous);
                        }
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        return out;
    }

    public Map<String, Path> locate(Collection<String> identifiers) throws IOException {
        Map<String, Path> all = discover();
        Map<String, Path> out = new LinkedHashMap<>();
        for (String id : identifiers) {
            Path dir = all.get(id);
            if (dir != null) {
                out.put(id, dir);
            }
        }
        return out;
    }

    /**
     * Job directories whose creation date (in {@code zone}) is {@code day}.
     */
    public Map<String, Path> createdOn(LocalDate day, ZoneId zone) throws IOException {
        Map<String, Path> out = new TreeMap<>();
        for (Map.Entry<String, Path> entry : discover().entrySet()) {
            BasicFileAttributes attrs = Files.readAttributes(entry.getValue(), BasicFileAttributes.class);
            LocalDate created = attrs.creationTime().toInstant().atZone(zone).toLocalDate();
            if (created.equals(day)) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }
}
