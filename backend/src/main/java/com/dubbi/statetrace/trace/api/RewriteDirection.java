package com.dubbi.statetrace.trace.api;

/**
 * /rewrite 요청의 치환 방향
 */
public enum RewriteDirection {
    SCREENS_TO_ORIGINAL,
    SCREENS_TO_CANONICAL,
    TRANSITIONS_TO_ORIGINAL;

    public static RewriteDirection fromNullable(String raw) {
        if (raw == null) return null;
        try {
            return RewriteDirection.valueOf(raw.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }
}
