package de.conciso.torrentbridge.library;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A monitored episode the library manager has not imported yet.
 *
 * @param series title of the owning series, when the library manager includes it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MissingEpisode(
        long id,
        long seriesId,
        int seasonNumber,
        int episodeNumber,
        String title,
        String airDateUtc,
        SeriesRef series) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeriesRef(String title) {}
}
