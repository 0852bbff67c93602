package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.comment.CommentRelayService;
import com.copyleft.CanvasSync.feature.comment.dto.CommentResolvedRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CommentResolvedHandler implements CollaborationEventHandler<CommentResolvedRequest> {

    private final CommentRelayService commentRelayService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.COMMENT_RESOLVED;
    }

    @Override
    public Class<CommentResolvedRequest> getPayloadType() {
        return CommentResolvedRequest.class;
    }

    @Override
    public void handle(String sessionId, CommentResolvedRequest payload) {
        commentRelayService.relayResolved(sessionId, payload);
    }
}
