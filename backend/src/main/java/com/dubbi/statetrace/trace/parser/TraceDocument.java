package com.dubbi.statetrace.trace.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * 메모리에 올라온 트레이스 문서 한 건
 * 줄바꿈은 \n 으로 통일한다.
 */
public final class TraceDocument {
    private final String text;

    private TraceDocument(String text) {
        this.text = text;
    }

    public static TraceDocument of(String rawText) {
        String normalized = rawText == null ? "" : rawText.replace("\r\n", "\n").replace('\r', '\n');
        return new TraceDocument(normalized);
    }

    public String text() {
        return text;
    }

    public List<String> lines() {
        return Arrays.asList(text.split("\n", -1));
    }

    /**
     * "States (n):" 헤더 뒤의 내용 (앞뒤 공백 제거)
     */
    public Optional<String> statesSection() {
        Matcher m = TracePatterns.STATES_HEADER.matcher(text);
        if (!m.find()) return Optional.empty();
        return Optional.of(m.group(1).strip());
    }

    /**
     * States 섹션을 화면 단위 논리 블록으로 나눈다.
     * 블록은 "해시," 로 시작하는 줄부터 다음 블록 시작 직전까지이며, 설명이 여러 줄에 걸칠 수 있다.
     */
    public List<String> screenBlocks() {
        Optional<String> section = statesSection();
        if (section.isEmpty()) return List.of();

        String states = section.get();
        List<Integer> starts = new ArrayList<>();
        Matcher m = TracePatterns.SCREEN_BLOCK_START.matcher(states);
        while (m.find()) {
            starts.add(m.start());
        }

        List<String> blocks = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : states.length();
            String block = states.substring(starts.get(i), end).strip();
            if (!block.isEmpty()) {
                blocks.add(block);
            }
        }
        return blocks;
    }
}
