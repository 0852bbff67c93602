package com.copyleft.CanvasSync.infra.websocket;

import com.copyleft.CanvasSync.global.messaging.OutboundEventSender;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender implements OutboundEventSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    @Override
    public void sendEventToSession(String sessionId, Object event) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session != null && session.isOpen()) {
            try {
                String payload = objectMapper.writeValueAsString(event);
                session.sendMessage(new TextMessage(payload));
                log.debug("이벤트 전송: [세션 ID: {}], [페이로드: {}]", sessionId, payload);
            } catch (IOException | SessionLimitExceededException e) {
                // 느린 수신자(버퍼/시간 초과)는 데코레이터가 세션을 닫는다. 다른 수신자에게는 영향 없음.
                log.error("이벤트 전송 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
            }
        } else {
            log.debug("세션을 찾을 수 없거나 닫혀있습니다: [세션 ID: {}]", sessionId);
        }
    }
}
