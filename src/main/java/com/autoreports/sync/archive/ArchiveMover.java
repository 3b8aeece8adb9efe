package com.autoreports.sync.archive;

import com.autoreports.sync.config.Config;
import com.autoreports.sync.model.RecordField;
import com.autoreports.sync.model.TaskRecord;
import com.autoreports.sync.model.TaskRuntimeInfo;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Moves the folder of a disabled job into the sibling archive directory.
 */
public final class ArchiveMover {
    private static final Logger log = LogManager.getLogger(ArchiveMover.class);

    private final String archiveFolderName;

    public ArchiveMover(String archiveFolderName) {
        this.archiveFolderName = archiveFolderName == null || archiveFolderName.isBlank() ? "Archive" : archiveFolderName.trim();
    }

    public static ArchiveMover fromConfig(Config config) {
        return new ArchiveMover(config.getString("archive.folder-name", "Archive"));
    }

    /**
     * Archives the job folder when the task is disabled and one of its action folders exists, is not empty
     * and lies outside the archive.
     *
     * @return the move performed, or empty when nothing applied
     */
    public Optional<ArchiveMove> archiveIfDisabled(TaskRuntimeInfo info) throws IOException {
        if (info == null || !info.isDisabled()) {
            return Optional.empty();
        }
        Path folder = resolveFolder(info.actionFolders());
        if (folder == null) {
            log.debug("{}: disabled, but no job folder to archive", info.identifier);
            return Optional.empty();
        }
        if (isInsideArchive(folder)) {
            return Optional.empty();
        }
        return Optional.of(move(info.identifier, folder));
    }

    /**
     * Moves {@code folder} to {@code <parent>/<Archive>/<name>}. An existing same-named archived folder is merged:
     * files are overwritten, sub-folders replaced, then the source is removed.
     */
    public ArchiveMove move(String identifier, Path folder) throws IOException {
        Path parent = folder.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IOException("cannot archive a root folder: " + folder);
        }
        Path archiveDir = parent.resolve(archiveFolderName);
        Files.createDirectories(archiveDir);
        Path target = archiveDir.resolve(folder.getFileName().toString());

        boolean merged = Files.exists(target);
        if (merged) {
            mergeInto(folder.toFile(), target.toFile());
            FileUtils.deleteDirectory(folder.toFile());
        } else {
            FileUtils.moveDirectory(folder.toFile(), target.toFile());
        }
        log.info("{}: archived {} -> {}{}", identifier, folder, target, merged ? " (merged)" : "");
        return new ArchiveMove(identifier, folder.toAbsolutePath(), target, merged);
    }

    public static TaskRecord toRecord(ArchiveMove move) {
        TaskRecord record = new TaskRecord(move.identifier());
        record.put(RecordField.ARCHIVED, Boolean.TRUE);
        record.put(RecordField.ARCHIVE_FOLDER, move.target().toString());
        return record;
    }

    private static void mergeInto(File source, File target) throws IOException {
        File[] children = source.listFiles();
        if (children == null) {
            throw new IOException("cannot list " + source);
        }
        for (File child : children) {
            File destination = new File(target, child.getName());
            if (child.isDirectory()) {
                if (destination.exists()) {
                    FileUtils.deleteDirectory(destination);
                }
                FileUtils.copyDirectory(child, destination);
            } else {
                FileUtils.copyFile(child, destination);
            }
        }
    }

    private boolean isInsideArchive(Path folder) {
        for (Path part : folder.toAbsolutePath()) {
            if (part.toString().equalsIgnoreCase(archiveFolderName)) {
                return true;
            }
        }
        return false;
    }

    private static Path resolveFolder(List<String> folders) {
        for (String candidate : folders) {
            try {
                Path path = Paths.get(candidate.trim());
                if (Files.isDirectory(path) && hasEntries(path)) {
                    return path;
                }
            } catch (InvalidPathException | IOException e) {
                log.debug("unusable job folder {}: {}", candidate, e.getMessage());
            }
        }
        return null;
    }

    private static boolean hasEntries(Path dir) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            return stream.iterator().hasNext();
        }
    }
}
