package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.presence.PresenceService;
import com.copyleft.CanvasSync.feature.presence.dto.CursorMoveRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CursorMoveHandler implements CollaborationEventHandler<CursorMoveRequest> {

    private final PresenceService presenceService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.CURSOR_MOVE;
    }

    @Override
    public Class<CursorMoveRequest> getPayloadType() {
        return CursorMoveRequest.class;
    }

    @Override
    public void handle(String sessionId, CursorMoveRequest payload) {
        presenceService.moveCursor(sessionId, payload.getX(), payload.getY());
    }
}
