package com.rewardradar.common;

/**
 * Shortens identifiers for logs and diagnostics output.
 */
public final class Redaction {

    private static final int VISIBLE_CHARS = 8;

    private Redaction() {
    }

    public static String shortId(String id) {
        if (id == null) {
            return "null";
        }
        return id.length() <= VISIBLE_CHARS ? id : id.substring(0, VISIBLE_CHARS);
    }
}
