package com.copyleft.CanvasSync.infra.websocket;

import com.copyleft.CanvasSync.feature.connection.ConnectionGuard;
import com.copyleft.CanvasSync.feature.router.EventRouter;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import com.copyleft.CanvasSync.infra.websocket.dto.WebSocketRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.InetSocketAddress;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketRouterHandler extends TextWebSocketHandler {

    static final String ORIGIN_ADDRESS_ATTR = "originAddress";
    static final String ACCEPTED_ATTR = "accepted";

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final ConnectionGuard connectionGuard;
    private final EventRouter eventRouter;
    private final CollaborationResponseSender responseSender;

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        String originAddress = resolveOriginAddress(session);
        session.getAttributes().put(ORIGIN_ADDRESS_ATTR, originAddress);

        if (!connectionGuard.acceptConnection(originAddress)) {
            log.warn("연결 거부 (주소별 한도 초과): session={}, address={}", session.getId(), originAddress);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Too many connections"));
            return;
        }

        session.getAttributes().put(ACCEPTED_ATTR, Boolean.TRUE);
        sessionManager.registerSession(session);
        connectionGuard.scheduleLifetimeLimit(session.getId(), () -> sessionManager.closeSession(
                session.getId(), CloseStatus.POLICY_VIOLATION.withReason("Connection lifetime exceeded")));

        log.info("새로운 세션 연결: {} ({})", session.getId(), originAddress);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, TextMessage message) {
        WebSocketRequest request;
        try {
            request = objectMapper.readValue(message.getPayload(), WebSocketRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("잘못된 메시지 형식: session={}, msg={}", session.getId(), e.getOriginalMessage());
            responseSender.sendError(session.getId(), ErrorCode.INVALID_MESSAGE);
            return;
        }

        if (request == null || !StringUtils.hasText(request.getEvent())) {
            responseSender.sendError(session.getId(), ErrorCode.INVALID_MESSAGE);
            return;
        }

        log.debug("이벤트 수신: {}, Session: {}", request.getEvent(), session.getId());
        eventRouter.dispatch(session.getId(), request.getEvent(), request.getPayload());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, @NonNull CloseStatus status) {
        log.info("세션 연결 종료: {} (사유: {})", session.getId(), status);
        sessionManager.removeSession(session);

        // 거부된 연결은 카운트를 올리지 않았으므로 정리할 것도 없다
        if (Boolean.TRUE.equals(session.getAttributes().get(ACCEPTED_ATTR))) {
            eventRouter.disconnect(session.getId(), (String) session.getAttributes().get(ORIGIN_ADDRESS_ATTR));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("전송 오류 발생: [세션 ID: {}], [오류: {}]", session.getId(), exception.getMessage());
    }

    private String resolveOriginAddress(WebSocketSession session) {
        String forwarded = session.getHandshakeHeaders().getFirst(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = session.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return null;
        }
        return remote.getAddress().getHostAddress();
    }
}
