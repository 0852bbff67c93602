package com.copyleft.CanvasSync.global.messaging;

/**
 * 특정 연결로 이벤트 하나를 보낸다. 전송 실패는 구현체가 기록하고 삼킨다 (best-effort).
 */
public interface OutboundEventSender {

    void sendEventToSession(String sessionId, Object event);
}
