package com.copyleft.CanvasSync.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    VALIDATION_ERROR("Invalid event payload"),
    RATE_LIMIT_EXCEEDED("Too many events, slow down"),

    ROOM_FULL("Design room is full"),
    NOT_IN_ROOM("Must join a design room first"),

    UNKNOWN_EVENT("Unknown event type"),
    INVALID_MESSAGE("Message must be a JSON object with an event name"),

    INTERNAL_ERROR("Failed to process event");

    private final String message;
}
