package com.copyleft.CanvasSync.feature.router.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 필드가 필요 없는 이벤트용 (leave_design, refresh_signal)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmptyPayload implements EventPayload<EmptyPayload> {

    @Override
    public EmptyPayload sanitized() {
        return this;
    }
}
