package de.conciso.torrentbridge.web;

import java.time.Instant;
import java.util.List;

import de.conciso.torrentbridge.ActivityLogWriter;
import de.conciso.torrentbridge.api.ActionResult;
import de.conciso.torrentbridge.watcher.FolderWatcher;
import de.conciso.torrentbridge.watcher.WatchedFile;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WatcherController.class)
class WatcherControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FolderWatcher folderWatcher;

    @MockBean
    private ActivityLogWriter activityLog;

    @Test
    void statusShowsDirectories() throws Exception {
        when(folderWatcher.status()).thenReturn(
                new FolderWatcher.WatcherStatus(true, "/data/torrents", "/data/downloads", 30, null, 2));

        mockMvc.perform(get("/watcher/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.torrentDir").value("/data/torrents"))
                .andExpect(jsonPath("$.dispatched").value(2));
    }

    @Test
    void startWithDirectories() throws Exception {
        mockMvc.perform(post("/watcher/start").param("torrent_dir", "/data/torrents").param("download_dir", "/data/dl"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(folderWatcher).start("/data/torrents", "/data/dl");
    }

    @Test
    void startWithoutTorrentDirIsBadRequest() throws Exception {
        mockMvc.perform(post("/watcher/start"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void startWithUnusableDirIsBadRequest() throws Exception {
        doThrow(new IllegalArgumentException("Cannot prepare watcher directories"))
                .when(folderWatcher).start(" ", null);

        mockMvc.perform(post("/watcher/start").param("torrent_dir", " "))
                .andExpect(status().isBadRequest());
    }

    @Test
    void scanListsPendingFiles() throws Exception {
        when(folderWatcher.scan()).thenReturn(List.of(
                new WatchedFile("a.torrent", "/data/torrents/a.torrent", 12, Instant.parse("2024-05-01T10:00:00Z"))));

        mockMvc.perform(get("/watcher/scan"))
                .andExpect(jsonPath("$[0].name").value("a.torrent"))
                .andExpect(jsonPath("$[0].size").value(12));
    }

    @Test
    void uploadOutsideWatchedDirIsConflict() throws Exception {
        when(folderWatcher.upload("/etc/passwd"))
                .thenReturn(ActionResult.of(ActionResult.Outcome.INVALID_STATE, "not inside"));

        mockMvc.perform(post("/watcher/upload").contentType(MediaType.APPLICATION_JSON).content("{\"path\":\"/etc/passwd\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void deleteMissingFileIsNotFound() throws Exception {
        when(folderWatcher.deleteFile("/data/torrents/x.torrent"))
                .thenReturn(ActionResult.of(ActionResult.Outcome.NOT_FOUND, "No such file"));

        mockMvc.perform(post("/watcher/delete-file").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"/data/torrents/x.torrent\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void logsAreCapped() throws Exception {
        when(activityLog.tail(1000)).thenReturn(List.of("line"));

        mockMvc.perform(get("/watcher/logs").param("lines", "5000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lines[0]").value("line"));
    }

    @Test
    void nonPositiveLineCountIsBadRequest() throws Exception {
        mockMvc.perform(get("/watcher/logs").param("lines", "0")).andExpect(status().isBadRequest());
        mockMvc.perform(get("/watcher/logs").param("lines", "abc")).andExpect(status().isBadRequest());

        verify(activityLog, never()).tail(anyInt());
    }
}
