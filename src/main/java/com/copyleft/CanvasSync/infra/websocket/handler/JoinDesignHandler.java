package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.session.DesignSessionService;
import com.copyleft.CanvasSync.feature.session.dto.JoinDesignRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JoinDesignHandler implements CollaborationEventHandler<JoinDesignRequest> {

    private final DesignSessionService designSessionService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.JOIN_DESIGN;
    }

    @Override
    public Class<JoinDesignRequest> getPayloadType() {
        return JoinDesignRequest.class;
    }

    @Override
    public void handle(String sessionId, JoinDesignRequest payload) {
        designSessionService.joinDesign(sessionId, payload);
    }
}
