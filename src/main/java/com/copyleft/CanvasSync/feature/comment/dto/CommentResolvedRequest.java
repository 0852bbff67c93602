package com.copyleft.CanvasSync.feature.comment.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommentResolvedRequest implements EventPayload<CommentResolvedRequest> {

    @NotNull(message = "Design ID is required")
    @Pattern(regexp = ValidationPatterns.DESIGN_ID, message = "Invalid design ID format")
    private final String designId;

    @NotNull(message = "Comment ID is required")
    @Pattern(regexp = ValidationPatterns.DESIGN_ID, message = "Invalid comment ID format")
    private final String commentId;

    @NotNull(message = "isResolved is required")
    private final Boolean isResolved;

    @Override
    public CommentResolvedRequest sanitized() {
        return this;
    }
}
