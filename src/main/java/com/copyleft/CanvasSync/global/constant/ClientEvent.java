package com.copyleft.CanvasSync.global.constant;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * 클라이언트가 보내는 이벤트. lowPriority 이벤트는 검증/속도 제한 실패 시 에러 없이 버린다.
 */
@Getter
@RequiredArgsConstructor
public enum ClientEvent {

    JOIN_DESIGN("join_design", RateLimitClass.DEFAULT, false),
    LEAVE_DESIGN("leave_design", RateLimitClass.DEFAULT, false),

    ELEMENT_OPERATION("element_operation", RateLimitClass.MUTATION, false),

    CURSOR_MOVE("cursor_move", RateLimitClass.PRESENCE, true),
    ELEMENT_DRAG_START("element_drag_start", RateLimitClass.PRESENCE, true),
    ELEMENT_DRAG_MOVE("element_drag_move", RateLimitClass.PRESENCE, true),
    ELEMENT_DRAG_END("element_drag_end", RateLimitClass.PRESENCE, true),
    USER_SELECTION("user_selection", RateLimitClass.PRESENCE, true),

    REFRESH_SIGNAL("refresh_signal", RateLimitClass.DEFAULT, false),

    COMMENT_CREATED("comment_created", RateLimitClass.DEFAULT, false),
    COMMENT_UPDATED("comment_updated", RateLimitClass.DEFAULT, false),
    COMMENT_DELETED("comment_deleted", RateLimitClass.DEFAULT, false),
    COMMENT_RESOLVED("comment_resolved", RateLimitClass.DEFAULT, false);

    private final String eventName;
    private final RateLimitClass rateLimitClass;
    private final boolean lowPriority;

    public static Optional<ClientEvent> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(e -> e.eventName.equals(eventName))
                .findFirst();
    }
}
