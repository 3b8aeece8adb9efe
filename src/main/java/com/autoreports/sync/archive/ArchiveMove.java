package com.autoreports.sync.archive;

import java.nio.file.Path;

/**
 * One job folder moved into its sibling archive. {@code merged} tells whether an existing archived copy was merged into.
 */
public record ArchiveMove(String identifier, Path source, Path target, boolean merged) {

    public Path parent() {
        Path parent = source.getParent();
        return parent == null ? source : parent;
    }
}
