package com.dubbi.statetrace.trace.rewrite;

import com.dubbi.statetrace.trace.domain.IdMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 임의의 텍스트 안에서 화면 ID를 정규 ID <-> 원본 해시로 치환
 *
 * 모든 치환은 단어 경계(\b) 기준이라 S1 이 S10, S1X 안에서 매치되지 않는다.
 */
public class ScreenIdRewriter {

    private static final Comparator<String> BY_NUMBER_DESC = Comparator
            .comparingInt((String id) -> IdMap.numberOf(id) < 0 ? 1 : 0) // 번호 없는 ID 는 뒤로
            .thenComparing(Comparator.<String>comparingInt(IdMap::numberOf).reversed())
            .thenComparing(Comparator.<String>reverseOrder());

    private static final Comparator<String> BY_LENGTH_DESC = Comparator
            .<String>comparingInt(String::length)
            .thenComparing(Comparator.<String>naturalOrder())
            .reversed();

    /**
     * S1 -> 원본 해시. S10 이 S1 보다 먼저 처리되도록 번호 내림차순으로 치환한다.
     */
    public static String canonicalToOriginal(String text, Map<String, String> canonicalToOriginal) {
        if (text == null || canonicalToOriginal == null || canonicalToOriginal.isEmpty()) return text;

        List<String> canonicalIds = new ArrayList<>(canonicalToOriginal.keySet());
        canonicalIds.sort(BY_NUMBER_DESC);

        String result = text;
        for (String canonicalId : canonicalIds) {
            String originalId = canonicalToOriginal.get(canonicalId);
            if (originalId == null) continue;
            result = replaceWholeToken(result, canonicalId, originalId);
        }
        return result;
    }

    /**
     * 원본 해시 -> S1. 긴 ID 부터 (길이가 같으면 사전순 역순) 치환해서 다른 ID 의 일부로 먹히지 않게 한다.
     */
    public static String originalToCanonical(String text, Map<String, String> originalToCanonical) {
        if (text == null || originalToCanonical == null || originalToCanonical.isEmpty()) return text;

        List<String> originalIds = new ArrayList<>(originalToCanonical.keySet());
        originalIds.sort(BY_LENGTH_DESC);

        String result = text;
        for (String originalId : originalIds) {
            String canonicalId = originalToCanonical.get(originalId);
            if (canonicalId == null) continue;
            result = replaceWholeToken(result, originalId, canonicalId);
        }
        return result;
    }

    private static String replaceWholeToken(String text, String token, String replacement) {
        if (token.isEmpty()) return text;
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(token) + "\\b");
        return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }
}
