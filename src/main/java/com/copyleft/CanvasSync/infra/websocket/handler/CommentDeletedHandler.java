package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.comment.CommentRelayService;
import com.copyleft.CanvasSync.feature.comment.dto.CommentDeletedRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CommentDeletedHandler implements CollaborationEventHandler<CommentDeletedRequest> {

    private final CommentRelayService commentRelayService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.COMMENT_DELETED;
    }

    @Override
    public Class<CommentDeletedRequest> getPayloadType() {
        return CommentDeletedRequest.class;
    }

    @Override
    public void handle(String sessionId, CommentDeletedRequest payload) {
        commentRelayService.relayDeleted(sessionId, payload);
    }
}
