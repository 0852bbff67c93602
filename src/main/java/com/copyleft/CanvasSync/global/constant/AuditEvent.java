package com.copyleft.CanvasSync.global.constant;

public enum AuditEvent {
    CONNECTION_LIMIT_EXCEEDED,
    CONNECTION_TIMEOUT,
    VALIDATION_FAILED,
    RATE_LIMIT_EXCEEDED,
    ROOM_SIZE_LIMIT_EXCEEDED,
    INACTIVE_MEMBER_REAPED,
    HANDLER_FAILED
}
