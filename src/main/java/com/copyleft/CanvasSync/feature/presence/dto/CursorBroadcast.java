package com.copyleft.CanvasSync.feature.presence.dto;

import com.copyleft.CanvasSync.domain.CursorPosition;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CursorBroadcast {
    private String userId;
    private String userName;
    private String userColor;
    private CursorPosition cursor;
}
