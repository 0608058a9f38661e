package de.conciso.torrentbridge.sync;

import java.util.Locale;

/** How transfer titles are compared for the duplicate check and for lookups. */
public enum TitleMatching {
    EXACT,
    CASE_INSENSITIVE;

    public String key(String title) {
        return this == CASE_INSENSITIVE ? title.toLowerCase(Locale.ROOT) : title;
    }

    /** Parses {@code exact} or {@code case-insensitive}. */
    public static TitleMatching fromProperty(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "exact" -> EXACT;
            case "case-insensitive", "case_insensitive" -> CASE_INSENSITIVE;
            default -> throw new IllegalArgumentException("Unknown title matching mode: " + value);
        };
    }
}
