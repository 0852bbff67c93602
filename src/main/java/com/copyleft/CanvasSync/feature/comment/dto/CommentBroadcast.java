package com.copyleft.CanvasSync.feature.comment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommentBroadcast {
    private String designId;
    private Map<String, Object> comment;
    private String commentId;
    private Boolean isResolved;
    private String userId;
    private String userName;
}
