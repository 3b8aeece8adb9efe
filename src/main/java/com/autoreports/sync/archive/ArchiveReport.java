package com.autoreports.sync.archive;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Archive moves of one run, grouped by the parent directory they were moved out of.
 */
public final class ArchiveReport {
    private final List<ArchiveMove> moves = new ArrayList<>();

    public synchronized void add(ArchiveMove move) {
        moves.add(move);
    }

    public synchronized boolean isEmpty() {
        return moves.isEmpty();
    }

    public synchronized List<ArchiveMove> moves() {
        return Collections.unmodifiableList(new ArrayList<>(moves));
    }

    public synchronized Map<Path, List<ArchiveMove>> groupedByParent() {
        Map<Path, List<ArchiveMove>> out = new TreeMap<>();
        for (ArchiveMove move : moves) {
            out.computeIfAbsent(move.parent(), key -> new ArrayList<>()).add(move);
        }
        for (List<ArchiveMove> group : out.values()) {
            group.sort((a, b) -> a.identifier().compareTo(b.identifier()));
        }
        return out;
    }
}
