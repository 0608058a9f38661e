package de.conciso.torrentbridge.web;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.conciso.torrentbridge.sync.SyncOrchestrator;
import de.conciso.torrentbridge.sync.Transfer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DownloadController {

    private final SyncOrchestrator orchestrator;

    public DownloadController(SyncOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    record DownloadRequest(String title, @JsonProperty("download_url") String downloadUrl,
                           @JsonProperty("series_id") Long seriesId) {}

    /** Active transfers; with {@code archived=true} the imported history instead. */
    @GetMapping("/downloads")
    public List<Transfer> list(@RequestParam(name = "archived", defaultValue = "false") boolean archived) {
        return archived ? orchestrator.archivedTransfers() : orchestrator.transfers();
    }

    @PostMapping("/downloads")
    public ResponseEntity<Map<String, Object>> add(@RequestBody DownloadRequest request) {
        return ActionResponses.of(orchestrator.submitUrl(request.title(), request.downloadUrl(), request.seriesId()));
    }

    @PostMapping("/downloads/{title}/pause")
    public ResponseEntity<Map<String, Object>> pause(@PathVariable String title) {
        return ActionResponses.of(orchestrator.pause(title));
    }

    @PostMapping("/downloads/{title}/resume")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String title) {
        return ActionResponses.of(orchestrator.resume(title));
    }

    @PostMapping("/downloads/{title}/download")
    public ResponseEntity<Map<String, Object>> download(@PathVariable String title) {
        return ActionResponses.of(orchestrator.manualDownload(title));
    }

    @PostMapping("/downloads/{title}/notify-sonarr")
    public ResponseEntity<Map<String, Object>> notifyLibrary(@PathVariable String title) {
        return ActionResponses.of(orchestrator.notify(title));
    }

    @PostMapping("/downloads/{title}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable String title) {
        return ActionResponses.of(orchestrator.retry(title));
    }

    @DeleteMapping("/downloads/{title}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String title) {
        return ActionResponses.of(orchestrator.delete(title));
    }
}
