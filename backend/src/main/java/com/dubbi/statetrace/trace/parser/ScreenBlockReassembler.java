package com.dubbi.statetrace.trace.parser;

import com.dubbi.statetrace.trace.domain.IdMap;
import com.dubbi.statetrace.trace.domain.ScreenCatalog;
import com.dubbi.statetrace.trace.domain.ScreenListing;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * States 섹션의 여러 줄짜리 화면 정의를 논리 블록으로 다시 묶고
 * 블록 맨 앞의 해시를 S 번호로 바꾼다.
 */
public class ScreenBlockReassembler {
    private static final Logger log = LoggerFactory.getLogger(ScreenBlockReassembler.class);

    private static final Pattern LEADING_SCREEN_ID = Pattern.compile("^S(\\d+)(?![0-9A-Za-z_])");

    /**
     * 매핑까지 새로 만들어서 재조립
     */
    public static ScreenListing reassemble(TraceDocument document) {
        ScreenCatalog catalog = ScreenIdCanonicalizer.canonicalize(document);
        ScreenListing listing = reassemble(document, catalog.screenIds());
        List<String> warnings = new ArrayList<>(catalog.warnings());
        warnings.addAll(listing.warnings());
        return new ScreenListing(listing.blocks(), listing.screenIds(), warnings);
    }

    /**
     * 중복 해시 블록도 걸러내지 않는다. 모든 블록이 S 번호 오름차순으로 정렬되어 나온다.
     */
    public static ScreenListing reassemble(TraceDocument document, IdMap screenIds) {
        List<String> warnings = new ArrayList<>();

        Optional<String> section = document.statesSection();
        if (section.isEmpty()) {
            log.debug("[Trace] No States section, nothing to reassemble");
            return new ScreenListing(List.of(), screenIds, warnings);
        }

        List<String> rawBlocks = document.screenBlocks();
        if (rawBlocks.isEmpty()) {
            String warning = "No valid screen definitions found in States section";
            log.warn("[Trace] {}", warning);
            warnings.add(warning);
            return new ScreenListing(List.of(), screenIds, warnings);
        }

        List<String> blocks = new ArrayList<>();
        for (String block : rawBlocks) {
            Matcher hash = TracePatterns.LEADING_HASH.matcher(block);
            if (!hash.lookingAt()) {
                String warning = "Screen block does not start with a hash: '" + TracePatterns.preview(block) + "'";
                log.warn("[Trace] {}", warning);
                warnings.add(warning);
                continue;
            }
            Optional<String> canonicalId = screenIds.canonicalOf(hash.group());
            if (canonicalId.isEmpty()) {
                String warning = "Hash " + hash.group() + " not found in screen id map, skipping block '"
                        + TracePatterns.preview(block) + "'";
                log.warn("[Trace] {}", warning);
                warnings.add(warning);
                continue;
            }
            blocks.add(canonicalId.get() + block.substring(hash.end()));
        }

        // List.sort 는 안정 정렬이라 같은 번호의 블록은 원래 순서를 유지한다
        blocks.sort(Comparator.comparingLong(ScreenBlockReassembler::sortKey));
        return new ScreenListing(blocks, screenIds, warnings);
    }

    /** S 번호를 읽을 수 없는 블록은 맨 뒤로 */
    static long sortKey(String block) {
        Matcher m = LEADING_SCREEN_ID.matcher(block);
        if (!m.lookingAt()) return Long.MAX_VALUE;
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
