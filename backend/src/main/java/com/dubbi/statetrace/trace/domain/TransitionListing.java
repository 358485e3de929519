package com.dubbi.statetrace.trace.domain;

import java.util.List;

/**
 * 정규화된 전이 라인 목록과 전이/화면 매핑
 */
public record TransitionListing(
        List<String> lines,
        IdMap transitionIds,
        IdMap screenIds,
        List<String> warnings
) {
    public TransitionListing {
        lines = List.copyOf(lines);
        warnings = List.copyOf(warnings);
    }

    public static TransitionListing empty() {
        return new TransitionListing(
                List.of(),
                IdMap.empty(IdMap.TRANSITION_PREFIX),
                IdMap.empty(IdMap.SCREEN_PREFIX),
                List.of()
        );
    }
}
