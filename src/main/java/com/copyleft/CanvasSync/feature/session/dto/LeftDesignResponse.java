package com.copyleft.CanvasSync.feature.session.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class LeftDesignResponse {
    private String designId;
}
