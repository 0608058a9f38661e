package de.conciso.torrentbridge;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Append-only log of pipeline events shown on the dashboard, one line per event:
 * <pre>
 * 2024-05-01T10:15:30Z | event=UPLOAD | title=Show.S01E01 | detail=id=42
 * </pre>
 * The file is rotated by size, keeping {@value #MAX_ROTATED_FILES} old generations.
 */
@Component
public class ActivityLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ActivityLogWriter.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    static final int MAX_ROTATED_FILES = 5;

    private final Path logPath;
    private final long maxSizeBytes;
    private final Clock clock;

    public ActivityLogWriter(
            @Value("${torrentbridge.activity-log.path:logs/activity.log}") String activityLogPath,
            @Value("${torrentbridge.activity-log.max-size-kb:1024}") long maxSizeKb,
            Clock clock) {
        this.logPath = Path.of(activityLogPath);
        this.maxSizeBytes = maxSizeKb * 1024;
        this.clock = clock;
    }

    public synchronized void record(String event, String title, String detail) {
        String timestamp = OffsetDateTime.now(clock).format(TIMESTAMP_FORMAT);
        String line = String.format("%s | event=%s | title=%s | detail=%s%n",
                timestamp,
                event,
                title != null ? title : "",
                detail != null ? detail.replace('\n', ' ') : "");
        try {
            Path parent = logPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            rotateIfNeeded();
            Files.writeString(logPath, line,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to write activity log entry for {}: {}", title, e.getMessage());
        }
    }

    /**
     * Returns the most recent {@code lines} entries, oldest first. Reads into the rotated
     * generations when the current file holds fewer lines.
     */
    public synchronized List<String> tail(int lines) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i <= MAX_ROTATED_FILES && result.size() < lines; i++) {
            Path file = (i == 0) ? logPath : Path.of(logPath + "." + i);
            if (!Files.exists(file)) {
                continue;
            }
            try {
                List<String> content = Files.readAllLines(file);
                for (int j = content.size() - 1; j >= 0 && result.size() < lines; j--) {
                    if (!content.get(j).isBlank()) {
                        result.add(content.get(j));
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", file, e.getMessage());
            }
        }
        Collections.reverse(result);
        return result;
    }

    private void rotateIfNeeded() throws IOException {
        if (!Files.exists(logPath) || Files.size(logPath) < maxSizeBytes) {
            return;
        }
        log.info("Rotating activity log (size exceeded {} KB)", maxSizeBytes / 1024);
        for (int i = MAX_ROTATED_FILES - 1; i >= 1; i--) {
            Path source = Path.of(logPath + "." + i);
            Path target = Path.of(logPath + "." + (i + 1));
            if (Files.exists(source)) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.move(logPath, Path.of(logPath + ".1"), StandardCopyOption.REPLACE_EXISTING);
    }
}
