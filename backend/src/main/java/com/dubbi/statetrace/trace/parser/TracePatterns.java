package com.dubbi.statetrace.trace.parser;

import java.util.regex.Pattern;

/**
 * 트레이스 파일 포맷 패턴 모음
 * 화면/전이 ID는 64자리 소문자 16진수 해시
 */
final class TracePatterns {
    private TracePatterns() {}

    static final String HASH = "[a-f0-9]{64}";

    static final String STATES_MARKER = "States";
    static final String TRANSITIONS_MARKER = "Transitions";

    /** "States (12):" 헤더 다음 줄부터 문서 끝까지 */
    static final Pattern STATES_HEADER = Pattern.compile(
            "^[ \\t]*States \\(\\d+\\):[ \\t]*\\n(.*)",
            Pattern.MULTILINE | Pattern.DOTALL
    );

    /** 화면 블록 시작: 줄 맨 앞의 해시 + 쉼표 */
    static final Pattern SCREEN_BLOCK_START = Pattern.compile("^" + HASH + ",", Pattern.MULTILINE);

    /** 화면 블록 헤더: 해시, 이름, ... (이름 필드는 다음 쉼표까지라 여러 줄에 걸칠 수 있다) */
    static final Pattern SCREEN_HEADER = Pattern.compile("^(" + HASH + "),\\s*([^,]+),");

    static final Pattern LEADING_HASH = Pattern.compile("^" + HASH);

    /** 문서 어디에 있든 전이 헤더 라인의 (s:..., t:...) 쌍 (전이 스캔처럼 앞 공백 허용) */
    static final Pattern TRANSITION_REFERENCE_LINE = Pattern.compile(
            "^[ \\t]*" + HASH + ":\\s*\\(s:\\s*([a-f0-9]+)\\s*,\\s*t:\\s*([a-f0-9]+)\\s*\\):.*",
            Pattern.MULTILINE
    );

    static final Pattern TRANSITION_RECORD_START = Pattern.compile("^" + HASH + ":");

    static final Pattern TRANSITION_HEADER = Pattern.compile(
            "^(" + HASH + "):\\s*\\(s:\\s*([a-f0-9]+)\\s*,\\s*t:\\s*([a-f0-9]+)\\s*\\):(.*)$"
    );

    /** 로그용 앞부분 미리보기 */
    static String preview(String text) {
        if (text == null) return "";
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() > 50 ? oneLine.substring(0, 50) + "..." : oneLine;
    }
}
