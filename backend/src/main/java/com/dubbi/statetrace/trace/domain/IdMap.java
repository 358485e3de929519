package com.dubbi.statetrace.trace.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 원본 해시 ID와 짧은 정규 ID(S1, T1 ...) 사이의 양방향 매핑
 * 문서 한 건을 파싱할 때 한 번 만들어지고 이후에는 변경되지 않는다.
 */
public final class IdMap {
    public static final String SCREEN_PREFIX = "S";
    public static final String TRANSITION_PREFIX = "T";

    private final String prefix;
    private final Map<String, String> canonicalToOriginal;
    private final Map<String, String> originalToCanonical;

    private IdMap(String prefix, Map<String, String> canonicalToOriginal, Map<String, String> originalToCanonical) {
        this.prefix = prefix;
        this.canonicalToOriginal = Collections.unmodifiableMap(canonicalToOriginal);
        this.originalToCanonical = Collections.unmodifiableMap(originalToCanonical);
    }

    public static Builder builder(String prefix) {
        return new Builder(prefix);
    }

    public static IdMap empty(String prefix) {
        return builder(prefix).build();
    }

    /** 정규 ID -> 원본 ID (할당 순서 유지) */
    public Map<String, String> canonicalToOriginal() {
        return canonicalToOriginal;
    }

    /** 원본 ID -> 정규 ID (할당 순서 유지) */
    public Map<String, String> originalToCanonical() {
        return originalToCanonical;
    }

    public Optional<String> originalOf(String canonicalId) {
        return Optional.ofNullable(canonicalToOriginal.get(canonicalId));
    }

    public Optional<String> canonicalOf(String originalId) {
        return Optional.ofNullable(originalToCanonical.get(originalId));
    }

    public int size() {
        return canonicalToOriginal.size();
    }

    public boolean isEmpty() {
        return canonicalToOriginal.isEmpty();
    }

    /**
     * 정규 ID의 숫자 부분 ("S12" -> 12)
     *
     * @return 접두사 한 글자 뒤가 숫자가 아니면 -1
     */
    public static int numberOf(String canonicalId) {
        if (canonicalId == null || canonicalId.length() < 2) return -1;
        String digits = canonicalId.substring(1);
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) return -1;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return "IdMap{" + prefix + ", size=" + size() + "}";
    }

    /**
     * 처음 등장한 순서대로 번호를 매긴다. 이미 본 원본 ID는 기존 번호를 그대로 돌려준다.
     */
    public static final class Builder {
        private final String prefix;
        private final Map<String, String> canonicalToOriginal = new LinkedHashMap<>();
        private final Map<String, String> originalToCanonical = new LinkedHashMap<>();
        private int nextId = 1;

        private Builder(String prefix) {
            this.prefix = prefix;
        }

        public String assign(String originalId) {
            String existing = originalToCanonical.get(originalId);
            if (existing != null) {
                return existing;
            }
            String canonicalId = prefix + nextId++;
            originalToCanonical.put(originalId, canonicalId);
            canonicalToOriginal.put(canonicalId, originalId);
            return canonicalId;
        }

        public boolean contains(String originalId) {
            return originalToCanonical.containsKey(originalId);
        }

        public IdMap build() {
            return new IdMap(prefix, new LinkedHashMap<>(canonicalToOriginal), new LinkedHashMap<>(originalToCanonical));
        }
    }
}
