package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.element.ElementService;
import com.copyleft.CanvasSync.feature.element.dto.ElementDragRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ElementDragStartHandler implements CollaborationEventHandler<ElementDragRequest> {

    private final ElementService elementService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.ELEMENT_DRAG_START;
    }

    @Override
    public Class<ElementDragRequest> getPayloadType() {
        return ElementDragRequest.class;
    }

    @Override
    public void handle(String sessionId, ElementDragRequest payload) {
        elementService.relayDrag(sessionId, SocketEvent.ELEMENT_DRAG_START, payload);
    }
}
