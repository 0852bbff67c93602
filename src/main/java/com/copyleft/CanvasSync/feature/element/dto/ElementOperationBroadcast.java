package com.copyleft.CanvasSync.feature.element.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementOperationBroadcast {
    private String type;
    private String designId;
    private String elementId;
    private CanvasElementPayload element;
    private Map<String, Object> updates;

    private String userId;  // 보낸 멤버
    private long timestamp; // 서버 시각 (순서 힌트일 뿐)
    private long version;   // 클라이언트 값이 없으면 timestamp

    public static ElementOperationBroadcast of(ElementOperationRequest request, String userId, long timestamp) {
        return ElementOperationBroadcast.builder()
                .type(request.getType())
                .designId(request.getDesignId())
                .elementId(request.getElementId())
                .element(request.getElement())
                .updates(request.getUpdates())
                .userId(userId)
                .timestamp(timestamp)
                .version(request.getVersion() != null ? request.getVersion() : timestamp)
                .build();
    }
}
