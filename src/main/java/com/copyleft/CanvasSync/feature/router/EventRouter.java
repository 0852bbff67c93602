package com.copyleft.CanvasSync.feature.router;

import com.copyleft.CanvasSync.feature.audit.AuditLogService;
import com.copyleft.CanvasSync.feature.connection.ConnectionGuard;
import com.copyleft.CanvasSync.feature.presence.PresenceRegistry;
import com.copyleft.CanvasSync.feature.ratelimit.RateLimiter;
import com.copyleft.CanvasSync.feature.session.DesignSessionService;
import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.EventValidator;
import com.copyleft.CanvasSync.feature.validation.Rejection;
import com.copyleft.CanvasSync.feature.validation.ValidationResult;
import com.copyleft.CanvasSync.global.constant.AuditEvent;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import com.copyleft.CanvasSync.infra.websocket.handler.CollaborationEventHandler;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 수신 이벤트 처리 순서: 이벤트 확인 -> 검증 -> 속도 제한 -> 활동 시각 갱신 -> 핸들러.
 * 전송 계층과 무관하게 세션 ID 와 JSON 만 받는다.
 */
@Slf4j
@Component
public class EventRouter {

    private final EventValidator eventValidator;
    private final RateLimiter rateLimiter;
    private final ConnectionGuard connectionGuard;
    private final PresenceRegistry presenceRegistry;
    private final DesignSessionService designSessionService;
    private final CollaborationResponseSender responseSender;
    private final AuditLogService auditLogService;

    private final Map<ClientEvent, CollaborationEventHandler<?>> handlerMap;

    public EventRouter(
            EventValidator eventValidator,
            RateLimiter rateLimiter,
            ConnectionGuard connectionGuard,
            PresenceRegistry presenceRegistry,
            DesignSessionService designSessionService,
            CollaborationResponseSender responseSender,
            AuditLogService auditLogService,
            List<CollaborationEventHandler<?>> handlers
    ) {
        this.eventValidator = eventValidator;
        this.rateLimiter = rateLimiter;
        this.connectionGuard = connectionGuard;
        this.presenceRegistry = presenceRegistry;
        this.designSessionService = designSessionService;
        this.responseSender = responseSender;
        this.auditLogService = auditLogService;
        this.handlerMap = handlers.stream()
                .collect(Collectors.toMap(CollaborationEventHandler::getEvent, Function.identity()));
    }

    public void dispatch(String sessionId, String eventName, JsonNode payload) {
        Optional<ClientEvent> event = ClientEvent.fromEventName(eventName);
        CollaborationEventHandler<?> handler = event.map(handlerMap::get).orElse(null);
        if (handler == null) {
            log.warn("알 수 없는 이벤트입니다: event={}, session={}", eventName, sessionId);
            responseSender.sendError(sessionId, ErrorCode.UNKNOWN_EVENT);
            return;
        }

        route(sessionId, event.get(), handler, payload);
    }

    /**
     * 연결 종료 정리. 중간에 실패해도 나머지 정리는 반드시 실행한다.
     */
    public void disconnect(String sessionId, String originAddress) {
        try {
            designSessionService.handleDisconnect(sessionId);
        } catch (Exception e) {
            log.error("연결 종료 처리 중 오류: session={}, msg={}", sessionId, e.getMessage(), e);
        } finally {
            rateLimiter.release(sessionId);
            connectionGuard.cancelLifetimeLimit(sessionId);
            connectionGuard.releaseConnection(originAddress);
        }
    }

    private <T extends EventPayload<T>> void route(String sessionId, ClientEvent event,
                                                   CollaborationEventHandler<T> handler, JsonNode payload) {
        ValidationResult<T> validation = eventValidator.validate(handler.getPayloadType(), payload);
        if (!validation.isValid()) {
            Rejection rejection = validation.getRejection();
            log.warn("검증 실패: event={}, session={}, reason={}", event.getEventName(), sessionId, rejection.describe());
            auditLogService.record(AuditEvent.VALIDATION_FAILED, Map.of(
                    "socketId", sessionId,
                    "eventType", event.getEventName(),
                    "error", rejection.describe()));
            if (!event.isLowPriority()) {
                responseSender.sendError(sessionId, ErrorCode.VALIDATION_ERROR, rejection.describe());
            }
            return;
        }

        if (!rateLimiter.allow(sessionId, event)) {
            // 커서/드래그 같은 저우선 이벤트는 기록 없이 버린다
            if (event.isLowPriority()) {
                return;
            }
            log.warn("속도 제한 초과: event={}, session={}", event.getEventName(), sessionId);
            auditLogService.record(AuditEvent.RATE_LIMIT_EXCEEDED, Map.of(
                    "socketId", sessionId,
                    "eventType", event.getEventName()));
            responseSender.sendError(sessionId, ErrorCode.RATE_LIMIT_EXCEEDED);
            return;
        }

        presenceRegistry.touch(sessionId);

        try {
            handler.handle(sessionId, validation.getValue());
        } catch (Exception e) {
            log.error("[{}] 처리 중 오류: session={}, msg={}", event.getEventName(), sessionId, e.getMessage(), e);
            auditLogService.record(AuditEvent.HANDLER_FAILED, Map.of(
                    "socketId", sessionId,
                    "eventType", event.getEventName(),
                    "error", String.valueOf(e.getMessage())));
            responseSender.sendError(sessionId, ErrorCode.INTERNAL_ERROR);
        }
    }
}
