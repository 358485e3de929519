package com.dubbi.statetrace.trace.parser;

import com.dubbi.statetrace.trace.domain.IdMap;
import com.dubbi.statetrace.trace.domain.ScreenCatalog;
import com.dubbi.statetrace.trace.domain.TransitionListing;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transitions 섹션의 각 전이 라인을 T/S 번호 기준으로 다시 쓴다.
 *
 * 입력:  &lt;hash&gt;: (s:&lt;hash&gt;, t:&lt;hash&gt;): act=(1) click, cp=[...] weight=0.5
 * 출력:  T1: (s:S1,t:S2): act=(1) click, cp=[...] weight=0.5
 */
public class TransitionLineNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TransitionLineNormalizer.class);

    /**
     * Transitions 섹션은 항상 States 섹션보다 앞에 있다. States 헤더를 만나면 스캔을 끝낸다.
     */
    enum ScanState {
        SCANNING,
        INSIDE_TRANSITIONS,
        DONE
    }

    static ScanState advance(ScanState current, String line) {
        if (current == ScanState.DONE) return ScanState.DONE;
        if (line.startsWith(TracePatterns.STATES_MARKER)) return ScanState.DONE;
        if (line.startsWith(TracePatterns.TRANSITIONS_MARKER)) return ScanState.INSIDE_TRANSITIONS;
        return current;
    }

    /**
     * 화면 매핑까지 새로 만들어서 정규화
     */
    public static TransitionListing normalize(TraceDocument document) {
        ScreenCatalog catalog = ScreenIdCanonicalizer.canonicalize(document);
        TransitionListing listing = normalize(document, catalog.screenIds());
        List<String> warnings = new ArrayList<>(catalog.warnings());
        warnings.addAll(listing.warnings());
        return new TransitionListing(listing.lines(), listing.transitionIds(), listing.screenIds(), warnings);
    }

    public static TransitionListing normalize(TraceDocument document, IdMap screenIds) {
        IdMap.Builder transitionIds = IdMap.builder(IdMap.TRANSITION_PREFIX);
        List<String> lines = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        ScanState state = ScanState.SCANNING;
        for (String rawLine : document.lines()) {
            String line = rawLine.strip();
            state = advance(state, line);
            if (state == ScanState.DONE) break;
            if (state != ScanState.INSIDE_TRANSITIONS) continue;
            if (!TracePatterns.TRANSITION_RECORD_START.matcher(line).lookingAt()) continue;

            Matcher header = TracePatterns.TRANSITION_HEADER.matcher(line);
            if (!header.matches()) {
                String warning = "Skipping transition without (s:..., t:...) header: '" + TracePatterns.preview(line) + "'";
                log.warn("[Trace] {}", warning);
                warnings.add(warning);
                continue;
            }

            String transitionId = transitionIds.assign(header.group(1));
            // 매핑에 없는 화면 해시는 원본 그대로 둔다
            String source = screenIds.canonicalOf(header.group(2)).orElse(header.group(2));
            String target = screenIds.canonicalOf(header.group(3)).orElse(header.group(3));
            String payload = header.group(4).strip();

            lines.add(String.format("%s: (s:%s,t:%s): %s", transitionId, source, target, payload));
        }

        IdMap transitions = transitionIds.build();
        log.debug("[Trace] Normalized {} transition lines ({} distinct transitions)", lines.size(), transitions.size());
        return new TransitionListing(lines, transitions, screenIds, warnings);
    }
}
