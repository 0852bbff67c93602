package com.copyleft.CanvasSync.infra.websocket.handler;

import com.copyleft.CanvasSync.feature.comment.CommentRelayService;
import com.copyleft.CanvasSync.feature.comment.dto.CommentChangeRequest;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CommentUpdatedHandler implements CollaborationEventHandler<CommentChangeRequest> {

    private final CommentRelayService commentRelayService;

    @Override
    public ClientEvent getEvent() {
        return ClientEvent.COMMENT_UPDATED;
    }

    @Override
    public Class<CommentChangeRequest> getPayloadType() {
        return CommentChangeRequest.class;
    }

    @Override
    public void handle(String sessionId, CommentChangeRequest payload) {
        commentRelayService.relayChange(sessionId, SocketEvent.COMMENT_UPDATED, payload);
    }
}
