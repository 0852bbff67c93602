package com.copyleft.CanvasSync.feature.session.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class UserJoinedResponse {
    private String userId;
    private String userName;
    private String userColor;
}
