package com.copyleft.CanvasSync.global.messaging;

import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Slf4j
@Component
@RequiredArgsConstructor
public class CollaborationResponseSender {

    private final OutboundEventSender eventSender;

    public void send(String sessionId, SocketEvent event, Object data) {
        eventSender.sendEventToSession(sessionId, createResponse(event, data));
    }

    public void broadcast(Collection<String> recipients, SocketEvent event, Object data) {
        if (recipients == null || recipients.isEmpty()) {
            return;
        }
        WebSocketResponse<Object> response = createResponse(event, data);
        for (String recipient : recipients) {
            eventSender.sendEventToSession(recipient, response);
        }
        log.debug("브로드캐스트: event={}, recipients={}", event.getEventName(), recipients.size());
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        sendError(sessionId, errorCode, errorCode.getMessage());
    }

    public void sendError(String sessionId, ErrorCode errorCode, String message) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ERROR.getEventName())
                .code(errorCode.name())
                .message(message)
                .build();
        eventSender.sendEventToSession(sessionId, response);
    }

    private WebSocketResponse<Object> createResponse(SocketEvent event, Object data) {
        return WebSocketResponse.builder()
                .event(event.getEventName())
                .data(data)
                .build();
    }
}
