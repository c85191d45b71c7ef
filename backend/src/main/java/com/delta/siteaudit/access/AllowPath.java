package com.delta.siteaudit.access;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Allow-list path syntax: dot-separated field names, where {@code name[]} applies the rest of
 * the path to every element of the array {@code name}.
 * For example {@code decision_readiness_audit[].status}.
 */
final class AllowPath {
    private static final Pattern SEGMENT = Pattern.compile("[a-z][a-z0-9_]*(\\[])?");

    private AllowPath() {
    }

    static List<String> segments(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty allow-list path");
        }
        List<String> segments = Arrays.asList(path.split("\\."));
        for (String segment : segments) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new IllegalArgumentException("Malformed allow-list path: " + path);
            }
        }
        return segments;
    }

    static String section(String path) {
        return stripArray(segments(path).get(0));
    }

    /** True when {@code broader} grants everything {@code narrower} does. */
    static boolean covers(String broader, String narrower) {
        List<String> wide = segments(broader);
        List<String> narrow = segments(narrower);
        if (wide.size() > narrow.size()) {
            return false;
        }
        for (int i = 0; i < wide.size(); i++) {
            if (!stripArray(wide.get(i)).equals(stripArray(narrow.get(i)))) {
                return false;
            }
        }
        return true;
    }

    private static String stripArray(String segment) {
        return segment.endsWith("[]") ? segment.substring(0, segment.length() - 2) : segment;
    }
}
