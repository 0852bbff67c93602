package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.presence.PresenceService;
import com.copyleft.CanvasSync.feature.presence.dto.UserSelectionRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserSelectionHandler implements CollaborationEventHandler<UserSelectionRequest> {

    private final PresenceService presenceService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.USER_SELECTION;
    }

    @Override
    public Class<UserSelectionRequest> getPayloadType() {
        return UserSelectionRequest.class;
    }

    @Override
    public void handle(String sessionId, UserSelectionRequest payload) {
        presenceService.changeSelection(sessionId, payload.getElementId());
    }
}
