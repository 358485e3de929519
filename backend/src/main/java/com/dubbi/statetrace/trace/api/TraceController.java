package com.dubbi.statetrace.trace.api;

import com.dubbi.statetrace.common.dto.ErrorResponse;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.ComponentDTO;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.EdgeDTO;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.GraphDTO;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.NodeDTO;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.RewriteRequest;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.ScreenListingDTO;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.TextDTO;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.TraceRequest;
import com.dubbi.statetrace.trace.api.dto.TraceDtos.TransitionListingDTO;
import com.dubbi.statetrace.trace.domain.ScreenListing;
import com.dubbi.statetrace.trace.domain.TraceGraph;
import com.dubbi.statetrace.trace.domain.TransitionListing;
import com.dubbi.statetrace.trace.parser.TraceDocument;
import com.dubbi.statetrace.trace.service.TraceParsingService;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 트레이스 파싱 API
 * 요청마다 파일을 새로 읽고 ID 매핑을 새로 만든다 (요청 간 캐시 없음).
 */
@RestController
@RequestMapping("/api/traces")
public class TraceController {
    private final TraceParsingService traceParsingService;

    public TraceController(TraceParsingService traceParsingService) {
        this.traceParsingService = traceParsingService;
    }

    @PostMapping("/screens")
    public ResponseEntity<ScreenListingDTO> screens(@Valid @RequestBody TraceRequest req) {
        var docOpt = load(req.path());
        if (docOpt.isEmpty()) return ResponseEntity.notFound().build();

        ScreenListing listing = traceParsingService.parseScreens(docOpt.get());
        return ResponseEntity.ok(new ScreenListingDTO(
                listing.blocks(),
                listing.screenIds().canonicalToOriginal(),
                listing.screenIds().originalToCanonical(),
                listing.warnings()
        ));
    }

    @PostMapping("/transitions")
    public ResponseEntity<TransitionListingDTO> transitions(@Valid @RequestBody TraceRequest req) {
        var docOpt = load(req.path());
        if (docOpt.isEmpty()) return ResponseEntity.notFound().build();

        TransitionListing listing = traceParsingService.parseTransitions(docOpt.get());
        return ResponseEntity.ok(new TransitionListingDTO(
                listing.lines(),
                traceParsingService.cleanTransitionLines(listing.lines()),
                traceParsingService.extractTransitionFields(listing.lines()),
                listing.transitionIds().canonicalToOriginal(),
                listing.transitionIds().originalToCanonical(),
                listing.screenIds().canonicalToOriginal(),
                listing.screenIds().originalToCanonical(),
                listing.warnings()
        ));
    }

    @PostMapping("/screen-names")
    public ResponseEntity<TextDTO> screenNames(@Valid @RequestBody TraceRequest req) {
        return load(req.path())
                .map(traceParsingService::listScreensWithNames)
                .map(text -> ResponseEntity.ok(new TextDTO(text)))
                .orElse(ResponseEntity.<TextDTO>notFound().build());
    }

    @PostMapping("/graph")
    public ResponseEntity<GraphDTO> graph(@Valid @RequestBody TraceRequest req) {
        var docOpt = load(req.path());
        if (docOpt.isEmpty()) return ResponseEntity.notFound().build();

        TraceGraph graph = traceParsingService.buildGraph(docOpt.get());
        var nodes = graph.nodes().stream()
                .map(n -> new NodeDTO(n.id(), n.originalId(), n.name()))
                .toList();
        var edges = graph.edges().stream()
                .map(e -> new EdgeDTO(
                        e.id(),
                        e.originalId(),
                        e.from(),
                        e.to(),
                        e.actionType().name(),
                        e.action(),
                        new ComponentDTO(
                                e.component().type(),
                                e.component().identifier(),
                                e.component().text(),
                                e.component().description()
                        )
                ))
                .toList();
        return ResponseEntity.ok(new GraphDTO(nodes, edges));
    }

    /**
     * 다운스트림에서 돌려받은 텍스트를 같은 트레이스의 매핑으로 치환
     */
    @PostMapping("/rewrite")
    public ResponseEntity<?> rewrite(@Valid @RequestBody RewriteRequest req) {
        RewriteDirection direction = RewriteDirection.fromNullable(req.direction());
        if (direction == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("INVALID_REQUEST", "Unknown direction: " + req.direction()));
        }

        var docOpt = load(req.path());
        if (docOpt.isEmpty()) return ResponseEntity.notFound().build();
        TraceDocument document = docOpt.get();

        String text = switch (direction) {
            case SCREENS_TO_ORIGINAL -> traceParsingService.rewriteCanonicalToOriginalScreens(
                    req.text(), traceParsingService.parseScreens(document).screenIds().canonicalToOriginal());
            case SCREENS_TO_CANONICAL -> traceParsingService.rewriteOriginalToCanonicalScreens(
                    req.text(), traceParsingService.parseScreens(document).screenIds().originalToCanonical());
            case TRANSITIONS_TO_ORIGINAL -> traceParsingService.normalizeTransitionReferences(
                    req.text(), traceParsingService.parseTransitions(document).transitionIds().canonicalToOriginal());
        };
        return ResponseEntity.ok(new TextDTO(text));
    }

    private Optional<TraceDocument> load(String path) {
        return traceParsingService.load(Path.of(path));
    }
}
