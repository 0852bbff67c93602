package com.copyleft.CanvasSync.feature.comment.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * comment_created / comment_updated. 댓글 본문은 저장 서비스가 이미 검증한 값을 그대로 전달한다.
 */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommentChangeRequest implements EventPayload<CommentChangeRequest> {

    @NotNull(message = "Design ID is required")
    @Pattern(regexp = ValidationPatterns.DESIGN_ID, message = "Invalid design ID format")
    private final String designId;

    @NotEmpty(message = "Comment is required")
    @Size(max = 50, message = "Comment has too many fields")
    private final Map<String, Object> comment;

    @Override
    public CommentChangeRequest sanitized() {
        return this;
    }
}
