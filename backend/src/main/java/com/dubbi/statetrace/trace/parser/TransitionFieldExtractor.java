package com.dubbi.statetrace.trace.parser;

import com.dubbi.statetrace.trace.domain.ComponentDescriptor;
import com.dubbi.statetrace.trace.domain.TransitionFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정규화된 전이 라인의 payload 에서 액션/컴포넌트 필드를 뽑는다.
 *
 * 예) T3: (s:S3,t:S4): act=(1) click, cp=[ty=Button,idx=permission_allow_button,tx=Allow,dsc=]
 *  -> T3: (s:S3,t:S4): Action = "click"; Component = [Type = "Button", Identifier = "permission_allow_button", Text = "Allow", Description = ""]
 */
public class TransitionFieldExtractor {
    // 키 앞에 다른 식별자 문자가 붙어 있으면 다른 키 (ctx= 안의 tx= 같은 경우)
    private static final String KEY_START = "(?<![A-Za-z0-9_])";

    private static final Pattern HEADER = Pattern.compile("^((T\\d+):\\s*\\(s:(S\\d+),t:(S\\d+)\\)):(.*)", Pattern.DOTALL);
    private static final Pattern ACTION = Pattern.compile(KEY_START + "act=\\(\\d+\\)\\s*([^,\\]]+)");
    private static final Pattern COMPONENT = Pattern.compile(KEY_START + "cp=(null|\\[.*?\\])", Pattern.DOTALL);
    private static final Pattern COMPONENT_TYPE = Pattern.compile(KEY_START + "ty=([^,\\]]+)");
    private static final Pattern COMPONENT_IDENTIFIER = Pattern.compile(KEY_START + "idx=([^,\\]]+)");
    private static final Pattern COMPONENT_TEXT = Pattern.compile(KEY_START + "tx=([^,\\]]+)");
    // dsc 는 보통 마지막 속성이라 쉼표를 포함해 컴포넌트 끝까지 읽는다
    private static final Pattern COMPONENT_DESCRIPTION = Pattern.compile(KEY_START + "dsc=([^\\]]*)");

    private static final Pattern WEIGHT_SUFFIX = Pattern.compile("\\s*weight=.*", Pattern.DOTALL);

    /**
     * 헤더가 "T#: (s:S#,t:S#):" 모양이 아닌 라인은 조용히 버린다.
     */
    public static List<TransitionFields> extract(List<String> normalizedLines) {
        List<TransitionFields> result = new ArrayList<>();
        for (String line : normalizedLines) {
            parse(line).ifPresent(result::add);
        }
        return result;
    }

    public static List<String> format(List<String> normalizedLines) {
        return extract(normalizedLines).stream().map(TransitionFields::format).toList();
    }

    public static Optional<TransitionFields> parse(String normalizedLine) {
        if (normalizedLine == null) return Optional.empty();
        Matcher header = HEADER.matcher(normalizedLine);
        if (!header.lookingAt()) return Optional.empty();

        String details = header.group(5).strip();
        String action = firstGroup(ACTION, details);

        return Optional.of(new TransitionFields(
                header.group(1).strip(),
                header.group(2),
                header.group(3),
                header.group(4),
                action,
                parseComponent(details)
        ));
    }

    static ComponentDescriptor parseComponent(String details) {
        Matcher cp = COMPONENT.matcher(details);
        if (!cp.find()) return ComponentDescriptor.EMPTY;

        String raw = cp.group(1);
        if (!raw.startsWith("[")) return ComponentDescriptor.EMPTY; // cp=null

        String inner = raw.substring(1, raw.length() - 1).strip();
        if (inner.isEmpty()) return ComponentDescriptor.EMPTY;

        return new ComponentDescriptor(
                firstGroup(COMPONENT_TYPE, inner),
                firstGroup(COMPONENT_IDENTIFIER, inner),
                firstGroup(COMPONENT_TEXT, inner),
                firstGroup(COMPONENT_DESCRIPTION, inner)
        );
    }

    /**
     * weight= 이후(앞 공백 포함)를 잘라낸다. 탐색 알고리즘 내부 값이라 의미 있는 payload 가 아니다.
     */
    public static String clean(String transitionLine) {
        if (transitionLine == null) return null;
        return WEIGHT_SUFFIX.matcher(transitionLine).replaceFirst("").strip();
    }

    public static List<String> clean(List<String> transitionLines) {
        List<String> cleaned = new ArrayList<>(transitionLines.size());
        for (String line : transitionLines) {
            cleaned.add(clean(line));
        }
        return cleaned;
    }

    private static String firstGroup(Pattern pattern, String input) {
        Matcher m = pattern.matcher(input);
        return m.find() ? m.group(1).strip() : "";
    }
}
