package de.conciso.torrentbridge.watcher;

import java.time.Instant;

/** A descriptor file in the watched directory that has not been dispatched yet. */
public record WatchedFile(String name, String path, long size, Instant lastModified) {}
