package com.copyleft.CanvasSync.feature.validation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class Rejection {
    private final String field;   // 위반한 필드 경로 (예: element.x)
    private final String rule;    // 위반한 규칙 (예: Pattern, NotNull, type)
    private final String message;

    public String describe() {
        return field + ": " + message;
    }
}
