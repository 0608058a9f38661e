package de.conciso.torrentbridge.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountInfo(
        String username,
        String email,
        @JsonProperty("space_used") Long spaceUsed,
        @JsonProperty("space_max") Long spaceMax) {}
