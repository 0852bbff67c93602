package com.copyleft.CanvasSync.infra.websocket.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketResponse<T> {
    private String event;   // 이벤트 이름 (SocketEvent.getEventName())
    private String code;    // 에러 코드
    private String message; // 에러 메시지

    private T data;
}
