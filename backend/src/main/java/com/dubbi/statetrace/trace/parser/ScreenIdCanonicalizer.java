package com.dubbi.statetrace.trace.parser;

import com.dubbi.statetrace.trace.domain.IdMap;
import com.dubbi.statetrace.trace.domain.ScreenCatalog;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 화면 해시 -> S 번호 매핑 생성
 *
 * 번호 순서:
 * 1. States 섹션에 선언된 순서 (같은 해시가 다시 나오면 첫 선언만 인정)
 * 2. Transitions 에서만 참조된 해시는 전이 라인에 처음 등장한 순서대로 뒤에 붙인다 (이름 없음)
 *
 * 같은 문서는 항상 같은 번호를 받는다.
 */
public class ScreenIdCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(ScreenIdCanonicalizer.class);

    public static ScreenCatalog canonicalize(TraceDocument document) {
        IdMap.Builder ids = IdMap.builder(IdMap.SCREEN_PREFIX);
        Map<String, String> names = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        // 1. States 섹션 선언 순서
        for (String block : document.screenBlocks()) {
            Matcher header = TracePatterns.SCREEN_HEADER.matcher(block);
            if (!header.lookingAt()) {
                String warning = "Skipping screen block without a name field: '" + TracePatterns.preview(block) + "'";
                log.warn("[Trace] {}", warning);
                warnings.add(warning);
                continue;
            }
            String hash = header.group(1);
            if (ids.contains(hash)) {
                log.debug("[Trace] Duplicate screen declaration ignored: {}", hash);
                continue;
            }
            ids.assign(hash);
            names.put(hash, displayName(header.group(2)));
        }

        // 2. 전이에서만 참조된 화면
        Matcher reference = TracePatterns.TRANSITION_REFERENCE_LINE.matcher(document.text());
        while (reference.find()) {
            appendIfAbsent(ids, names, reference.group(1));
            appendIfAbsent(ids, names, reference.group(2));
        }

        IdMap screenIds = ids.build();
        log.debug("[Trace] Canonicalized {} screens ({} declared in States)", screenIds.size(),
                names.values().stream().filter(n -> n != null).count());
        return new ScreenCatalog(screenIds, names, warnings);
    }

    /** 이름 필드가 설명 줄까지 이어지면 첫 줄만 이름으로 쓴다 */
    static String displayName(String nameField) {
        String name = nameField.strip();
        int newline = name.indexOf('\n');
        return newline < 0 ? name : name.substring(0, newline).strip();
    }

    private static void appendIfAbsent(IdMap.Builder ids, Map<String, String> names, String hash) {
        if (ids.contains(hash)) return;
        ids.assign(hash);
        names.put(hash, null);
    }
}
