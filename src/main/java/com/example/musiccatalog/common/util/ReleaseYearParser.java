package com.example.musiccatalog.common.util;

/**
 * Derives a release year from a raw tag value such as {@code "2015-06-01"} or {@code " 2015 "}.
 */
public final class ReleaseYearParser {

    private ReleaseYearParser() {
    }

    /**
     * Takes the part before the first '-', drops whitespace and parses it.
     *
     * @return the year, or {@code null} when nothing parseable remains
     */
    public static Integer parse(String rawYear) {
        if (rawYear == null) {
            return null;
        }
        int dashIdx = rawYear.indexOf('-');
        String head = dashIdx >= 0 ? rawYear.substring(0, dashIdx) : rawYear;
        String compact = head.replaceAll("\\s+", "");
        if (compact.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(compact);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
