package com.copyleft.CanvasSync.feature.element.dto;

import com.copyleft.CanvasSync.domain.CursorPosition;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ElementDragBroadcast {
    private String userId;
    private String userName;
    private String userColor;
    private String elementId;
    private CursorPosition position;
}
