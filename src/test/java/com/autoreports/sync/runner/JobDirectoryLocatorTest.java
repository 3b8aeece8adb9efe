package com.autoreports.sync.runner;

import com.autoreports.sync.model.IdentifierConvention;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobDirectoryLocatorTest {
    private final IdentifierConvention convention = new IdentifierConvention(List.of("REQ", "RA"), 15);

    @TempDir
    Path root;

    @Test
    void discoverSkipsIgnoredFoldersAndDoesNotDescendIntoJobs() throws IOException {
        Files.createDirectories(root.resolve("finance").resolve("REQ000000000001").resolve("RA0000000000002"));
        Files.createDirectories(root.resolve("Archive").resolve("REQ000000000003"));
        Files.createDirectories(root.resolve("!example").resolve("REQ000000000004"));
        Files.createDirectories(root.resolve("hr").resolve("deep").resolve("RA0000000000005"));
        Files.createDirectories(root.resolve("hr").resolve("REQ12"));

        JobDirectoryLocator locator = new JobDirectoryLocator(List.of(root), List.of("archive", "!example"), convention);
        Map<String, Path> found = locator.discover();

        assertEquals(List.of("RA0000000000005", "REQ000000000001"), List.copyOf(found.keySet()));
        assertEquals(root.resolve("hr").resolve("deep").resolve("RA0000000000005"), found.get("RA0000000000005"));
    }

    @Test
    void firstRootWinsOnDuplicates(@TempDir Path second) throws IOException {
        Files.createDirectories(root.resolve("REQ000000000001"));
        Files.createDirectories(second.resolve("REQ000000000001"));

        JobDirectoryLocator locator = new JobDirectoryLocator(List.of(root, second), List.of(), convention);

        assertEquals(root.resolve("REQ000000000001"), locator.discover().get("REQ000000000001"));
    }

    @Test
    void locateKeepsRequestOrderAndDropsUnknown() throws IOException {
        Files.createDirectories(root.resolve("a").resolve("REQ000000000001"));
        Files.createDirectories(root.resolve("b").resolve("REQ000000000002"));

        JobDirectoryLocator locator = new JobDirectoryLocator(List.of(root, root.resolve("missing")), List.of(), convention);
        Map<String, Path> found = locator.locate(List.of("REQ000000000002", "REQ000000000009", "REQ000000000001"));

        assertEquals(List.of("REQ000000000002", "REQ000000000001"), List.copyOf(found.keySet()));
    }

    @Test
    void createdOnFiltersByCreationDay() throws IOException {
        Files.createDirectories(root.resolve("REQ000000000001"));
        JobDirectoryLocator locator = new JobDirectoryLocator(List.of(root), List.of(), convention);
        ZoneId zone = ZoneId.systemDefault();

        assertTrue(locator.createdOn(LocalDate.now(zone), zone).containsKey("REQ000000000001"));
        assertTrue(locator.createdOn(LocalDate.now(zone).minusYears(5), zone).isEmpty());
    }
}
