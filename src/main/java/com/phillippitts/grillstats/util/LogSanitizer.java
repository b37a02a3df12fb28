package com.phillippitts.grillstats.util;

/** Makes client-supplied identifiers safe to put into log lines and the MDC. */
public final class LogSanitizer {

    /** Longest identifier kept in logs. */
    public static final int MAX_ID_LENGTH = 64;

    private LogSanitizer() {}

    /**
     * Replaces control characters (CR, LF, tabs...) with '_' and truncates to {@code max}
     * characters; returns "" for null or a non-positive max.
     */
    public static String clean(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String t = s.length() <= max ? s : s.substring(0, max);
        StringBuilder sb = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return sb.toString();
    }

    /** {@link #clean(String, int)} with {@link #MAX_ID_LENGTH}. */
    public static String id(String s) {
        return clean(s, MAX_ID_LENGTH);
    }
}
