package de.conciso.torrentbridge.sync;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Local record of one torrent's way from submission to library import. Immutable; the
 * {@link TransferTracker} replaces instances on every change.
 *
 * @param id       stable local identifier
 * @param cloudId  identifier assigned by the cloud store
 * @param progress fraction in [0,1]
 * @param error    reason, set while {@code status} is {@link TransferStatus#ERROR}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Transfer(
        String id,
        String title,
        @JsonProperty("uploaded_at") Instant uploadedAt,
        @JsonProperty("cloud_id") String cloudId,
        TransferStatus status,
        double progress,
        Long size,
        @JsonProperty("series_id") Long seriesId,
        String error,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("updated_at") Instant updatedAt) {

    public Transfer withStatus(TransferStatus newStatus, Instant now) {
        String newError = newStatus == TransferStatus.ERROR ? error : null;
        return new Transfer(id, title, uploadedAt, cloudId, newStatus, progress, size, seriesId, newError, retryCount, now);
    }

    public Transfer withError(String reason, Instant now) {
        return new Transfer(id, title, uploadedAt, cloudId, TransferStatus.ERROR, progress, size, seriesId, reason, retryCount, now);
    }

    public Transfer withProgress(double newProgress, Long newSize, Instant now) {
        return new Transfer(id, title, uploadedAt, cloudId, status, newProgress, newSize != null ? newSize : size,
                seriesId, error, retryCount, now);
    }

    public Transfer withRetryCount(int count, Instant now) {
        return new Transfer(id, title, uploadedAt, cloudId, status, progress, size, seriesId, error, count, now);
    }
}
