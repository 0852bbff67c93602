package com.copyleft.CanvasSync.feature.element.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ElementDragRequest implements EventPayload<ElementDragRequest> {

    @NotNull(message = "Element ID is required")
    @Size(min = 1, max = 1000, message = "Element ID must be between 1 and 1000 characters")
    @Pattern(regexp = ValidationPatterns.ELEMENT_ID,
            message = "Element ID can only contain letters, numbers, underscores, and hyphens")
    private final String elementId;

    @NotNull(message = "X coordinate is required")
    @DecimalMin(value = ValidationPatterns.CANVAS_MIN, message = "X coordinate out of bounds")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "X coordinate out of bounds")
    private final Double x;

    @NotNull(message = "Y coordinate is required")
    @DecimalMin(value = ValidationPatterns.CANVAS_MIN, message = "Y coordinate out of bounds")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "Y coordinate out of bounds")
    private final Double y;

    @Override
    public ElementDragRequest sanitized() {
        return this;
    }
}
