package de.conciso.torrentbridge.web;

import java.util.LinkedHashMap;
import java.util.Map;

import de.conciso.torrentbridge.api.ActionResult;
import de.conciso.torrentbridge.api.ApiError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Translates orchestration outcomes into HTTP responses. */
final class ActionResponses {

    private ActionResponses() {
    }

    static HttpStatus status(ActionResult.Outcome outcome) {
        return switch (outcome) {
            case OK -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE, DUPLICATE -> HttpStatus.CONFLICT;
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }

    static ResponseEntity<Map<String, Object>> of(ActionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.isOk());
        body.put("message", result.message());
        return ResponseEntity.status(status(result.outcome())).body(body);
    }

    static ResponseEntity<Map<String, Object>> of(ApiError error) {
        return of(ActionResult.fromError(error));
    }
}
