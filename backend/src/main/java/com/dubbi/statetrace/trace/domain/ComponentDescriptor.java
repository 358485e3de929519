package com.dubbi.statetrace.trace.domain;

/**
 * 액션이 가리키는 UI 컴포넌트 (cp=[ty=..., idx=..., tx=..., dsc=...])
 * 값이 없는 속성은 빈 문자열
 */
public record ComponentDescriptor(
        String type,
        String identifier,
        String text,
        String description
) {
    public static final ComponentDescriptor EMPTY = new ComponentDescriptor("", "", "", "");

    public ComponentDescriptor {
        type = type == null ? "" : type;
        identifier = identifier == null ? "" : identifier;
        text = text == null ? "" : text;
        description = description == null ? "" : description;
    }

    public boolean isEmpty() {
        return type.isEmpty() && identifier.isEmpty() && text.isEmpty() && description.isEmpty();
    }
}
