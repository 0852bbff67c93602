package com.copyleft.CanvasSync.infra.websocket.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebSocketRequest {

    private String event;

    private JsonNode payload;
}
