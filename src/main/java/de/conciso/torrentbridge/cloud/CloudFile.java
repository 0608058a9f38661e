package de.conciso.torrentbridge.cloud;

public record CloudFile(String name, long size, String downloadUrl) {}
