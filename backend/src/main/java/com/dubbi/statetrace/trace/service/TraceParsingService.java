package com.dubbi.statetrace.trace.service;

import com.dubbi.statetrace.trace.domain.IdMap;
import com.dubbi.statetrace.trace.domain.ScreenCatalog;
import com.dubbi.statetrace.trace.domain.ScreenListing;
import com.dubbi.statetrace.trace.domain.TraceGraph;
import com.dubbi.statetrace.trace.domain.TraceGraph.ScreenNode;
import com.dubbi.statetrace.trace.domain.TraceGraph.TransitionEdge;
import com.dubbi.statetrace.trace.domain.TransitionFields;
import com.dubbi.statetrace.trace.domain.TransitionListing;
import com.dubbi.statetrace.trace.parser.ScreenBlockReassembler;
import com.dubbi.statetrace.trace.parser.ScreenIdCanonicalizer;
import com.dubbi.statetrace.trace.parser.TraceDocument;
import com.dubbi.statetrace.trace.parser.TraceDocumentReader;
import com.dubbi.statetrace.trace.parser.TransitionFieldExtractor;
import com.dubbi.statetrace.trace.parser.TransitionLineNormalizer;
import com.dubbi.statetrace.trace.rewrite.ScreenIdRewriter;
import com.dubbi.statetrace.trace.rewrite.TransitionReferenceNormalizer;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 트레이스 파싱 진입점
 *
 * 상태를 들고 있지 않는다. 호출할 때마다 파일을 다시 읽고 ID 매핑도 새로 만든다.
 * 파일이 없으면 빈 결과를 돌려준다.
 */
@Service
public class TraceParsingService {
    private final Path baseDir;
    private final String unknownScreenName;

    public TraceParsingService(
            @Value("${statetrace.trace.base-dir:}") String baseDir,
            @Value("${statetrace.screens.unknown-name:Unknown Screen}") String unknownScreenName
    ) {
        this.baseDir = (baseDir == null || baseDir.isBlank()) ? null : Path.of(baseDir).toAbsolutePath().normalize();
        this.unknownScreenName = unknownScreenName;
    }

    /**
     * 상대 경로는 statetrace.trace.base-dir 기준
     *
     * @throws InvalidPathException base-dir 이 설정되어 있는데 그 밖을 가리킬 때 (절대 경로, ../ 포함)
     */
    public Path resolve(Path path) {
        if (path == null) return null;
        if (baseDir == null) return path.normalize();

        Path resolved = baseDir.resolve(path).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new InvalidPathException(path.toString(), "Trace path is outside " + baseDir);
        }
        return resolved;
    }

    public Optional<TraceDocument> load(Path path) {
        return TraceDocumentReader.read(resolve(path));
    }

    // ---- 화면 ----

    public ScreenListing parseScreens(Path path) {
        return load(path).map(this::parseScreens).orElse(ScreenListing.empty());
    }

    public ScreenListing parseScreens(TraceDocument document) {
        return ScreenBlockReassembler.reassemble(document);
    }

    /**
     * "S1: Login" 형식으로 한 줄에 하나씩, S 번호 오름차순
     */
    public String listScreensWithNames(Path path) {
        return load(path).map(this::listScreensWithNames).orElse("");
    }

    public String listScreensWithNames(TraceDocument document) {
        ScreenCatalog catalog = ScreenIdCanonicalizer.canonicalize(document);
        List<Map.Entry<String, String>> entries = new ArrayList<>(catalog.screenIds().canonicalToOriginal().entrySet());
        entries.sort(Comparator.comparingInt(e -> IdMap.numberOf(e.getKey())));

        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String> entry : entries) {
            String name = catalog.nameOf(entry.getValue()).orElse(unknownScreenName);
            lines.add(entry.getKey() + ": " + name);
        }
        return String.join("\n", lines);
    }

    // ---- 전이 ----

    public TransitionListing parseTransitions(Path path) {
        return load(path).map(this::parseTransitions).orElse(TransitionListing.empty());
    }

    public TransitionListing parseTransitions(TraceDocument document) {
        return TransitionLineNormalizer.normalize(document);
    }

    public List<String> cleanTransitionLines(List<String> lines) {
        return TransitionFieldExtractor.clean(lines);
    }

    public List<String> extractTransitionFields(List<String> normalizedLines) {
        return TransitionFieldExtractor.format(normalizedLines);
    }

    // ---- 그래프 ----

    public TraceGraph buildGraph(Path path) {
        return load(path).map(this::buildGraph).orElse(TraceGraph.empty());
    }

    public TraceGraph buildGraph(TraceDocument document) {
        ScreenCatalog catalog = ScreenIdCanonicalizer.canonicalize(document);
        IdMap screenIds = catalog.screenIds();

        List<ScreenNode> nodes = screenIds.canonicalToOriginal().entrySet().stream()
                .map(e -> new ScreenNode(e.getKey(), e.getValue(), catalog.nameOf(e.getValue()).orElse(null)))
                .toList();

        TransitionListing transitions = TransitionLineNormalizer.normalize(document, screenIds);
        IdMap transitionIds = transitions.transitionIds();

        List<TransitionEdge> edges = new ArrayList<>();
        for (TransitionFields fields : TransitionFieldExtractor.extract(transitions.lines())) {
            edges.add(new TransitionEdge(
                    fields.transitionId(),
                    transitionIds.originalOf(fields.transitionId()).orElse(null),
                    fields.sourceId(),
                    fields.targetId(),
                    fields.actionType(),
                    fields.action(),
                    fields.component()
            ));
        }
        return new TraceGraph(nodes, edges);
    }

    // ---- 텍스트 치환 ----

    public String rewriteCanonicalToOriginalScreens(String text, Map<String, String> canonicalToOriginal) {
        return ScreenIdRewriter.canonicalToOriginal(text, canonicalToOriginal);
    }

    public String rewriteOriginalToCanonicalScreens(String text, Map<String, String> originalToCanonical) {
        return ScreenIdRewriter.originalToCanonical(text, originalToCanonical);
    }

    public String normalizeTransitionReferences(String text, Map<String, String> transitionIdMap) {
        return TransitionReferenceNormalizer.normalize(text, transitionIdMap);
    }
}
