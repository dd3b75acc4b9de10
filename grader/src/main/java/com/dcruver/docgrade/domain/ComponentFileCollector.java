package com.dcruver.docgrade.domain;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects candidate files under a project root without descending into excluded directories.
 * Unreadable entries are recorded instead of aborting the walk.
 */
@Slf4j
class ComponentFileCollector extends SimpleFileVisitor<Path> {

    private final Path root;
    private final Set<String> excludedDirectories;

    private final List<Path> files = new ArrayList<>();
    private final List<Path> unreadable = new ArrayList<>();

    ComponentFileCollector(Path root, Set<String> excludedDirectories) {
        this.root = root;
        this.excludedDirectories = excludedDirectories;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (!dir.equals(root) && dir.getFileName() != null
            && excludedDirectories.contains(dir.getFileName().toString())) {
            log.debug("Skipping excluded directory {}", dir);
            return FileVisitResult.SKIP_SUBTREE;
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile()) {
            files.add(file);
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException e) {
        log.warn("Cannot read {}: {}", file, e.getMessage());
        unreadable.add(file);
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException e) {
        if (e != null) {
            log.warn("Listing of {} ended early: {}", dir, e.getMessage());
            unreadable.add(dir);
        }
        return FileVisitResult.CONTINUE;
    }

    /**
     * Regular files found, in path order
     */
    List<Path> getFiles() {
        return files.stream().sorted().toList();
    }

    List<Path> getUnreadable() {
        return unreadable.stream().sorted().toList();
    }
}
