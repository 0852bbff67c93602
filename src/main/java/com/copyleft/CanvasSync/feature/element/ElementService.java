package com.copyleft.CanvasSync.feature.element;

import com.copyleft.CanvasSync.domain.CursorPosition;
import com.copyleft.CanvasSync.feature.element.dto.ElementDragBroadcast;
import com.copyleft.CanvasSync.feature.element.dto.ElementDragRequest;
import com.copyleft.CanvasSync.feature.element.dto.ElementOperationBroadcast;
import com.copyleft.CanvasSync.feature.element.dto.ElementOperationRequest;
import com.copyleft.CanvasSync.feature.presence.PresenceRegistry;
import com.copyleft.CanvasSync.feature.presence.Relay;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 요소 변경/드래그 중계. 서버는 캔버스 상태를 갖지 않고, 받은 연산을 같은 방에 그대로 전달한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ElementService {

    private final PresenceRegistry presenceRegistry;
    private final CollaborationResponseSender responseSender;

    public void applyOperation(String sessionId, ElementOperationRequest operation) {
        Optional<String> currentDesign = presenceRegistry.findDesignId(sessionId);
        if (currentDesign.isEmpty() || !currentDesign.get().equals(operation.getDesignId())) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }

        Optional<Relay<ElementOperationBroadcast>> relay = presenceRegistry.relayOperation(sessionId, operation);
        if (relay.isEmpty()) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }

        responseSender.broadcast(relay.get().getRecipients(), SocketEvent.ELEMENT_OPERATION, relay.get().getPayload());
        log.debug("요소 연산 중계: design={}, type={}, element={}",
                operation.getDesignId(), operation.getType(), operation.getElementId());
    }

    /**
     * element_drag_start / move / end 공통. 방에 없으면 조용히 버린다.
     */
    public void relayDrag(String sessionId, SocketEvent event, ElementDragRequest drag) {
        Optional<Relay<ElementDragBroadcast>> relay = presenceRegistry.relayFrom(sessionId, (designId, member) ->
                ElementDragBroadcast.builder()
                        .userId(member.getMemberId())
                        .userName(member.getDisplayName())
                        .userColor(member.getColor().getCode())
                        .elementId(drag.getElementId())
                        .position(new CursorPosition(drag.getX(), drag.getY()))
                        .build());

        relay.ifPresent(r -> responseSender.broadcast(r.getRecipients(), event, r.getPayload()));
    }
}
