package com.copyleft.CanvasSync.global.constant;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SocketEvent {
    JOINED_DESIGN("joined_design"),   // 입장 성공 (본인)
    USER_JOINED("user_joined"),       // 다른 멤버 입장
    USER_LEFT("user_left"),           // 다른 멤버 퇴장
    LEFT_DESIGN("left_design"),       // 퇴장 확인 (본인)

    ELEMENT_OPERATION("element_operation"),
    CURSOR_MOVE("cursor_move"),
    ELEMENT_DRAG_START("element_drag_start"),
    ELEMENT_DRAG_MOVE("element_drag_move"),
    ELEMENT_DRAG_END("element_drag_end"),
    USER_SELECTION("user_selection"),

    REFRESH_SIGNAL("refresh_signal"),

    COMMENT_CREATED("comment_created"),
    COMMENT_UPDATED("comment_updated"),
    COMMENT_DELETED("comment_deleted"),
    COMMENT_RESOLVED("comment_resolved"),

    ERROR("error");

    private final String eventName;
}
