package com.planwright.core.model;

import java.util.Comparator;

/**
 * Helpers for dotted task ids such as {@code "3.1"} or {@code "12.4"}.
 */
public final class TaskIds {

    /**
     * Orders ids segment by segment, numerically when both segments are numbers,
     * so that {@code 5.9} sorts before {@code 5.10}.
     */
    public static final Comparator<String> ORDER = TaskIds::compare;

    private TaskIds() {}

    /**
     * Returns the phase part of a dotted id: everything before the last dot,
     * or the whole id when it has no dot.
     */
    public static String phaseOf(String taskId) {
        int dot = taskId.lastIndexOf('.');
        return dot > 0 ? taskId.substring(0, dot) : taskId;
    }

    public static int compare(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        int n = Math.min(left.length, right.length);
        for (int i = 0; i < n; i++) {
            int cmp = compareSegment(left[i], right[i]);
            if (cmp != 0) return cmp;
        }
        return Integer.compare(left.length, right.length);
    }

    private static int compareSegment(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            int cmp = Long.compare(Long.parseLong(a), Long.parseLong(b));
            if (cmp != 0) return cmp;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty() || s.length() > 18) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
