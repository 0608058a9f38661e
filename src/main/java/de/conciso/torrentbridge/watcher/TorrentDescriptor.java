package de.conciso.torrentbridge.watcher;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;

/**
 * A torrent or magnet file discovered in the watched directory.
 *
 * @param title file name without its extension
 */
public record TorrentDescriptor(Path path, String title, Kind kind, Instant discoveredAt) {

    public enum Kind {
        TORRENT(".torrent"),
        MAGNET(".magnet");

        private final String extension;

        Kind(String extension) {
            this.extension = extension;
        }

        public String extension() {
            return extension;
        }

        /** The kind for a file name, or {@code null} if the extension is not recognized. */
        public static Kind of(String fileName) {
            String lower = fileName.toLowerCase(Locale.ROOT);
            for (Kind kind : values()) {
                if (lower.endsWith(kind.extension)) {
                    return kind;
                }
            }
            return null;
        }
    }

    public static TorrentDescriptor of(Path path, Instant discoveredAt) {
        String fileName = path.getFileName().toString();
        Kind kind = Kind.of(fileName);
        if (kind == null) {
            throw new IllegalArgumentException("Not a torrent or magnet file: " + fileName);
        }
        String title = fileName.substring(0, fileName.length() - kind.extension().length());
        return new TorrentDescriptor(path.toAbsolutePath(), title, kind, discoveredAt);
    }
}
