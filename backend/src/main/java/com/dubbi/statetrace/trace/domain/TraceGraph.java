package com.dubbi.statetrace.trace.domain;

import java.util.List;

/**
 * 정규 ID 기준의 탐색 그래프 (화면 = 노드, 전이 = 엣지)
 */
public record TraceGraph(List<ScreenNode> nodes, List<TransitionEdge> edges) {
    public TraceGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static TraceGraph empty() {
        return new TraceGraph(List.of(), List.of());
    }

    /**
     * @param name States 섹션에 선언되지 않은 화면이면 null
     */
    public record ScreenNode(String id, String originalId, String name) {}

    public record TransitionEdge(
            String id,
            String originalId,
            String from,
            String to,
            ActionType actionType,
            String action,
            ComponentDescriptor component
    ) {}
}
