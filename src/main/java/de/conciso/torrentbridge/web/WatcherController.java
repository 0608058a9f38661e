package de.conciso.torrentbridge.web;

import java.util.List;
import java.util.Map;

import de.conciso.torrentbridge.ActivityLogWriter;
import de.conciso.torrentbridge.watcher.FolderWatcher;
import de.conciso.torrentbridge.watcher.WatchedFile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WatcherController {

    private static final int MAX_LOG_LINES = 1000;

    private final FolderWatcher folderWatcher;
    private final ActivityLogWriter activityLog;

    public WatcherController(FolderWatcher folderWatcher, ActivityLogWriter activityLog) {
        this.folderWatcher = folderWatcher;
        this.activityLog = activityLog;
    }

    record PathRequest(String path) {}

    @GetMapping("/watcher/status")
    public FolderWatcher.WatcherStatus status() {
        return folderWatcher.status();
    }

    @PostMapping("/watcher/start")
    public Map<String, Object> start(@RequestParam("torrent_dir") String torrentDir,
                                     @RequestParam(name = "download_dir", required = false) String downloadDir) {
        folderWatcher.start(torrentDir, downloadDir);
        return Map.of("success", true, "message", "Watching " + torrentDir);
    }

    @PostMapping("/watcher/stop")
    public Map<String, Object> stop() {
        folderWatcher.stop();
        return Map.of("success", true);
    }

    @GetMapping("/watcher/scan")
    public List<WatchedFile> scan() {
        return folderWatcher.scan();
    }

    @PostMapping("/watcher/upload")
    public ResponseEntity<Map<String, Object>> upload(@RequestBody PathRequest request) {
        return ActionResponses.of(folderWatcher.upload(request.path()));
    }

    @PostMapping("/watcher/delete-file")
    public ResponseEntity<Map<String, Object>> deleteFile(@RequestBody PathRequest request) {
        return ActionResponses.of(folderWatcher.deleteFile(request.path()));
    }

    @GetMapping("/watcher/logs")
    public Map<String, Object> logs(@RequestParam(name = "lines", defaultValue = "50") int lines) {
        if (lines < 1) {
            throw new IllegalArgumentException("lines must be positive");
        }
        return Map.of("lines", activityLog.tail(Math.min(lines, MAX_LOG_LINES)));
    }
}
