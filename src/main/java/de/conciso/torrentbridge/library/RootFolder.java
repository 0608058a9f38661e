package de.conciso.torrentbridge.library;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RootFolder(long id, String path, Long freeSpace) {}
