package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.global.constant.ClientEvent;

/**
 * 이벤트 하나를 처리하는 핸들러. payload 는 검증과 속도 제한을 통과한 뒤에 전달된다.
 */
public interface CollaborationEventHandler<T extends EventPayload<T>> {

    ClientEvent getEvent();

    Class<T> getPayloadType();

    void handle(String sessionId, T payload);
}
