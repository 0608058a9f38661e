package de.conciso.torrentbridge.api;

/**
 * Outcome of a user-facing or pipeline operation, translated to an HTTP status by the web layer.
 */
public record ActionResult(Outcome outcome, String message) {

    public enum Outcome {
        OK,
        NOT_FOUND,
        INVALID_STATE,
        DUPLICATE,
        UNAUTHENTICATED,
        FAILED
    }

    public static ActionResult ok(String message) {
        return new ActionResult(Outcome.OK, message);
    }

    public static ActionResult of(Outcome outcome, String message) {
        return new ActionResult(outcome, message);
    }

    /** Maps a failed client call to the outcome the caller reports. */
    public static ActionResult fromError(ApiError error) {
        Outcome outcome = switch (error.kind()) {
            case UNAUTHENTICATED -> Outcome.UNAUTHENTICATED;
            case NOT_FOUND -> Outcome.NOT_FOUND;
            default -> Outcome.FAILED;
        };
        return new ActionResult(outcome, error.message());
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
