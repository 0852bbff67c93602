package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.element.ElementService;
import com.copyleft.CanvasSync.feature.element.dto.ElementOperationRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ElementOperationHandler implements CollaborationEventHandler<ElementOperationRequest> {

    private final ElementService elementService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.ELEMENT_OPERATION;
    }

    @Override
    public Class<ElementOperationRequest> getPayloadType() {
        return ElementOperationRequest.class;
    }

    @Override
    public void handle(String sessionId, ElementOperationRequest payload) {
        elementService.applyOperation(sessionId, payload);
    }
}
