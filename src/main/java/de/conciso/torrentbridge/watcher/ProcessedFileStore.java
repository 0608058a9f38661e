package de.conciso.torrentbridge.watcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names of descriptor files that were already dispatched, one per line in an append-only file.
 */
class ProcessedFileStore {

    private static final Logger log = LoggerFactory.getLogger(ProcessedFileStore.class);

    private final Path file;
    private final Set<String> names = new HashSet<>();

    ProcessedFileStore(Path file) {
        this.file = file;
        if (Files.exists(file)) {
            try {
                for (String line : Files.readAllLines(file)) {
                    if (!line.isBlank()) names.add(line.trim());
                }
                log.info("Loaded {} processed file name(s) from {}", names.size(), file);
            } catch (IOException e) {
                log.warn("Failed to read processed-files list {}: {}", file, e.getMessage());
            }
        }
    }

    synchronized boolean contains(String name) {
        return names.contains(name);
    }

    synchronized void add(String name) {
        if (!names.add(name)) {
            return;
        }
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, name + System.lineSeparator(),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to record {} as processed: {}", name, e.getMessage());
        }
    }
}
