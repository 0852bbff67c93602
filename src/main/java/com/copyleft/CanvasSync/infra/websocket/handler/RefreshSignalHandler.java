package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.router.dto.EmptyPayload;
import com.copyleft.CanvasSync.feature.session.DesignSessionService;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RefreshSignalHandler implements CollaborationEventHandler<EmptyPayload> {

    private final DesignSessionService designSessionService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.REFRESH_SIGNAL;
    }

    @Override
    public Class<EmptyPayload> getPayloadType() {
        return EmptyPayload.class;
    }

    @Override
    public void handle(String sessionId, EmptyPayload payload) {
        designSessionService.refreshSignal(sessionId);
    }
}
