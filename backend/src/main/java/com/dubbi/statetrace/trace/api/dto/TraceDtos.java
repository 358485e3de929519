package com.dubbi.statetrace.trace.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public final class TraceDtos {
    private TraceDtos() {}

    public record TraceRequest(
            @NotBlank String path
    ) {}

    public record RewriteRequest(
            @NotBlank String path,
            @NotNull String text,
            @NotBlank String direction
    ) {}

    public record ScreenListingDTO(
            List<String> blocks,
            Map<String, String> canonicalToOriginal,
            Map<String, String> originalToCanonical,
            List<String> warnings
    ) {}

    public record TransitionListingDTO(
            List<String> lines,
            List<String> cleanedLines,
            List<String> extracted,
            Map<String, String> transitionCanonicalToOriginal,
            Map<String, String> transitionOriginalToCanonical,
            Map<String, String> screenCanonicalToOriginal,
            Map<String, String> screenOriginalToCanonical,
            List<String> warnings
    ) {}

    public record TextDTO(String text) {}

    public record GraphDTO(List<NodeDTO> nodes, List<EdgeDTO> edges) {}

    public record NodeDTO(
            String id,
            String originalId,
            String name
    ) {}

    public record EdgeDTO(
            String id,
            String originalId,
            String from,
            String to,
            String actionType,
            String action,
            ComponentDTO component
    ) {}

    public record ComponentDTO(
            String type,
            String identifier,
            String text,
            String description
    ) {}
}
