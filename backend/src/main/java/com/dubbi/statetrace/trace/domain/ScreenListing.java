package com.dubbi.statetrace.trace.domain;

import java.util.List;

/**
 * 재조립된 화면 블록 목록 (S 번호 오름차순)
 */
public record ScreenListing(
        List<String> blocks,
        IdMap screenIds,
        List<String> warnings
) {
    public ScreenListing {
        blocks = List.copyOf(blocks);
        warnings = List.copyOf(warnings);
    }

    public static ScreenListing empty() {
        return new ScreenListing(List.of(), IdMap.empty(IdMap.SCREEN_PREFIX), List.of());
    }
}
