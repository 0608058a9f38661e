package de.conciso.torrentbridge.web;

import java.util.List;
import java.util.function.Supplier;

import de.conciso.torrentbridge.api.ApiResult;
import de.conciso.torrentbridge.library.LibraryClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only pass-throughs to the library manager for the dashboard. */
@RestController
public class LibraryController {

    private final LibraryClient libraryClient;

    public LibraryController(LibraryClient libraryClient) {
        this.libraryClient = libraryClient;
    }

    @GetMapping("/library/series")
    public ResponseEntity<?> series() {
        return respond(libraryClient::listSeries);
    }

    @GetMapping("/library/rootfolders")
    public ResponseEntity<?> rootFolders() {
        return respond(libraryClient::listRootFolders);
    }

    @GetMapping("/library/missing")
    public ResponseEntity<?> missing() {
        return respond(libraryClient::listMissingEpisodes);
    }

    private static <T> ResponseEntity<?> respond(Supplier<ApiResult<List<T>>> call) {
        ApiResult<List<T>> result = call.get();
        if (!result.isOk()) {
            return ActionResponses.of(result.error());
        }
        return ResponseEntity.ok(result.value());
    }
}
