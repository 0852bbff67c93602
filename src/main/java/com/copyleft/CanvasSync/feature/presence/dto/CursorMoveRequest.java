package com.copyleft.CanvasSync.feature.presence.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CursorMoveRequest implements EventPayload<CursorMoveRequest> {

    @NotNull(message = "X coordinate is required")
    @DecimalMin(value = ValidationPatterns.CANVAS_MIN, message = "X coordinate out of bounds")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "X coordinate out of bounds")
    private final Double x;

    @NotNull(message = "Y coordinate is required")
    @DecimalMin(value = ValidationPatterns.CANVAS_MIN, message = "Y coordinate out of bounds")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "Y coordinate out of bounds")
    private final Double y;

    @Override
    public CursorMoveRequest sanitized() {
        return this;
    }
}
