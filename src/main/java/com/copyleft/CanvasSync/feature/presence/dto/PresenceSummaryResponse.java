package com.copyleft.CanvasSync.feature.presence.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PresenceSummaryResponse {
    private int rooms;
    private int members;
}
