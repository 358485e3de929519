package com.dubbi.statetrace.trace.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 화면 ID 정규화 결과
 * 화면 매핑 + States 섹션에 선언된 화면 이름 (Transitions 에서만 참조된 화면은 이름 없음)
 */
public record ScreenCatalog(
        IdMap screenIds,
        Map<String, String> namesByOriginal,
        List<String> warnings
) {
    public ScreenCatalog {
        // 이름이 없는 화면은 null 값으로 들어오므로 Map.copyOf 는 쓰지 않는다
        namesByOriginal = Collections.unmodifiableMap(new LinkedHashMap<>(namesByOriginal));
        warnings = List.copyOf(warnings);
    }

    public Optional<String> nameOf(String originalId) {
        return Optional.ofNullable(namesByOriginal.get(originalId));
    }
}
