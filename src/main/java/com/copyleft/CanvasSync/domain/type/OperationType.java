package com.copyleft.CanvasSync.domain.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum OperationType {
    ELEMENT_ADDED("element_added"),
    ELEMENT_UPDATED("element_updated"),
    ELEMENT_DELETED("element_deleted"),
    ELEMENT_MOVED("element_moved"),
    ELEMENT_TRANSFORMED("element_transformed");

    private static final String PREFIX = "element_";

    private final String code;

    /**
     * "element_added" 와 축약형 "added" 를 모두 받는다.
     */
    public static Optional<OperationType> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.startsWith(PREFIX) ? value : PREFIX + value;
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized))
                .findFirst();
    }
}
