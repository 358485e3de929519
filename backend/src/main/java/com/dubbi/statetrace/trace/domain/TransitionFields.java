package com.dubbi.statetrace.trace.domain;

/**
 * 정규화된 전이 라인에서 뽑아낸 필드
 *
 * @param header "T3: (s:S3,t:S4)" 형태의 원문 헤더
 */
public record TransitionFields(
        String header,
        String transitionId,
        String sourceId,
        String targetId,
        String action,
        ComponentDescriptor component
) {
    public TransitionFields {
        action = action == null ? "" : action;
        component = component == null ? ComponentDescriptor.EMPTY : component;
    }

    public ActionType actionType() {
        return ActionType.fromAction(action);
    }

    /**
     * T3: (s:S3,t:S4): Action = "click"; Component = [Type = "Button", Identifier = "...", Text = "...", Description = ""]
     */
    public String format() {
        return String.format(
                "%s: Action = \"%s\"; Component = [Type = \"%s\", Identifier = \"%s\", Text = \"%s\", Description = \"%s\"]",
                header,
                action,
                component.type(),
                component.identifier(),
                component.text(),
                component.description()
        );
    }
}
