package com.copyleft.CanvasSync.feature.presence.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SelectionBroadcast {
    private String userId;
    private String userName;
    private String userColor;
    private String elementId; // null = 선택 해제
}
