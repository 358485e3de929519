package com.dubbi.statetrace.trace.domain;

import java.util.Locale;

/**
 * 사용자 행동 타입
 * 트레이스의 act= 값은 탐색 도구마다 표기가 달라서 느슨하게 분류한다.
 */
public enum ActionType {
    CLICK,      // 버튼/링크 클릭
    LONG_CLICK, // 길게 누르기
    INPUT,      // 텍스트 입력
    SCROLL,     // 스크롤
    SWIPE,      // 스와이프
    BACK,       // 뒤로 가기
    NAVIGATE,   // 앱 실행, 딥링크 등 직접 이동
    OTHER;

    public static ActionType fromAction(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (key.startsWith("long_click") || key.startsWith("longclick") || key.startsWith("long_press")) return LONG_CLICK;
        if (key.startsWith("click") || key.startsWith("tap")) return CLICK;
        if (key.startsWith("input") || key.startsWith("set_text") || key.startsWith("type") || key.startsWith("enter")) return INPUT;
        if (key.startsWith("scroll")) return SCROLL;
        if (key.startsWith("swipe")) return SWIPE;
        if (key.startsWith("back") || key.startsWith("press_back")) return BACK;
        if (key.startsWith("launch") || key.startsWith("start") || key.startsWith("navigate") || key.startsWith("open")) return NAVIGATE;
        return OTHER;
    }
}
