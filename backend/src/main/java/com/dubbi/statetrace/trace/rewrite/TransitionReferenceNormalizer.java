package com.dubbi.statetrace.trace.rewrite;

import com.dubbi.statetrace.trace.domain.IdMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 모델 응답 등 사람이 쓴 텍스트 안의 전이 참조를 원본 전이 ID 태그(&lt;원본ID&gt;)로 바꾼다.
 *
 * 인식하는 표기 (대소문자 무시, 왼쪽부터 먼저 매치된 대안이 이긴다):
 * - &lt;T1&gt;, &lt;1&gt;, (T1), (1), [T1], [1]  (줄 끝)
 * - transition_id=6, (transition_id: T46), transition_id-7  (줄 끝)
 * - (transition T1), transition T2  (줄 끝)
 * - Transition: T11, Transition T11  (줄 전체)
 * - T5, 5  (줄 전체)
 * - 문장 중간의 "transition T3" 은 T3 부분만 바꾼다
 *
 * 매핑에 없는 번호는 &lt;T#&gt; 로 그대로 남긴다. 인식하지 못한 표기는 건드리지 않는다.
 */
public class TransitionReferenceNormalizer {

    // 줄바꿈은 매치에 포함하지 않는다
    private static final String LINE_END = "[ \\t]*$";

    private static final Pattern REFERENCE = Pattern.compile(
            "<\\s*T?(\\d+)\\s*>" + LINE_END
                    + "|\\(\\s*T?(\\d+)\\s*\\)" + LINE_END
                    + "|\\[\\s*T?(\\d+)\\s*\\]" + LINE_END
                    + "|(?:[(<\\[][ \\t]*)?transition_id[ \\t]*[:=\\-][ \\t]*T?[ \\t]*(\\d+)[ \\t]*[)> \\]]?" + LINE_END
                    + "|(?:\\([ \\t]*)?transition[ \\t]+T?(\\d+)[ \\t]*\\)?" + LINE_END
                    + "|^Transition[: ][ \\t]*T?(\\d+)" + LINE_END
                    + "|^T?(\\d+)" + LINE_END
                    + "|(?<=\\btransition:?[ \\t])T(\\d+)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE
    );

    public static String normalize(String text, Map<String, String> transitionIdMap) {
        if (text == null || text.isEmpty()) return text;

        Map<String, String> normalizedMap = new HashMap<>();
        if (transitionIdMap != null) {
            transitionIdMap.forEach((k, v) -> {
                if (k != null) normalizedMap.put(k.strip().toUpperCase(Locale.ROOT), v);
            });
        }

        Matcher m = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String transitionId = canonicalize(firstNonNullGroup(m));
            String originalId = normalizedMap.getOrDefault(transitionId, transitionId);
            m.appendReplacement(sb, Matcher.quoteReplacement("<" + originalId + ">"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** "7" -> "T7", "t7" -> "T7" */
    static String canonicalize(String numeral) {
        String id = numeral.strip().toUpperCase(Locale.ROOT);
        if (!id.isEmpty() && id.chars().allMatch(Character::isDigit)) {
            return IdMap.TRANSITION_PREFIX + id;
        }
        return id;
    }

    private static String firstNonNullGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            String group = m.group(i);
            if (group != null) return group;
        }
        return "";
    }
}
