package com.familygraph.service;

import java.util.Comparator;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for free-form, possibly partial dates ("1850", "abt 1850", "1850-03-02", "2 Mar 1850").
 */
public final class PartialDates {

    private static final Pattern YEAR = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern ISO = Pattern.compile("(\\d{4})-(\\d{2})(?:-(\\d{2}))?");

    /** Earlier dates first; blank or null dates sort after all dated values. */
    public static final Comparator<String> EARLIEST_FIRST = PartialDates::compare;

    private PartialDates() {
    }

    /** First four-digit year in the value. */
    public static OptionalInt extractYear(String date) {
        if (date == null) {
            return OptionalInt.empty();
        }
        Matcher m = YEAR.matcher(date);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /**
     * Compare by year, then by ISO month and day where present. Values with the
     * same key compare equal ("1850" and "abt 1850"); values without a year sort last.
     */
    public static int compare(String a, String b) {
        return Long.compare(sortKey(a), sortKey(b));
    }

    private static long sortKey(String date) {
        OptionalInt year = extractYear(date);
        if (year.isEmpty()) {
            return Long.MAX_VALUE;
        }
        int month = 0;
        int day = 0;
        Matcher iso = ISO.matcher(date);
        if (iso.find()) {
            month = Integer.parseInt(iso.group(2));
            day = iso.group(3) != null ? Integer.parseInt(iso.group(3)) : 0;
        }
        return year.getAsInt() * 10_000L + month * 100L + day;
    }
}
