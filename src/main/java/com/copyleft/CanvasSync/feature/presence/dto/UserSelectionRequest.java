package com.copyleft.CanvasSync.feature.presence.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserSelectionRequest implements EventPayload<UserSelectionRequest> {

    // null 이면 선택 해제
    @Size(min = 1, max = 1000, message = "Element ID must be between 1 and 1000 characters")
    @Pattern(regexp = ValidationPatterns.ELEMENT_ID,
            message = "Element ID can only contain letters, numbers, underscores, and hyphens")
    private final String elementId;

    @Override
    public UserSelectionRequest sanitized() {
        return this;
    }
}
