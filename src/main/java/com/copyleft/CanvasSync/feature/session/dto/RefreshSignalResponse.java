package com.copyleft.CanvasSync.feature.session.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RefreshSignalResponse {
    private String designId;
    private String userId;
    private String userName;
}
