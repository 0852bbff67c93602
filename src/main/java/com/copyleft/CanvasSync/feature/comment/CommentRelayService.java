package com.copyleft.CanvasSync.feature.comment;

import com.copyleft.CanvasSync.domain.Member;
import com.copyleft.CanvasSync.feature.comment.dto.CommentBroadcast;
import com.copyleft.CanvasSync.feature.comment.dto.CommentChangeRequest;
import com.copyleft.CanvasSync.feature.comment.dto.CommentDeletedRequest;
import com.copyleft.CanvasSync.feature.comment.dto.CommentResolvedRequest;
import com.copyleft.CanvasSync.feature.presence.PresenceRegistry;
import com.copyleft.CanvasSync.feature.presence.Relay;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Function;

/**
 * 댓글 변경 알림 중계. 댓글 저장은 다른 서비스가 하고, 여기서는 같은 방 멤버에게 알리기만 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentRelayService {

    private final PresenceRegistry presenceRegistry;
    private final CollaborationResponseSender responseSender;

    public void relayChange(String sessionId, SocketEvent event, CommentChangeRequest request) {
        relay(sessionId, request.getDesignId(), event, member -> CommentBroadcast.builder()
                .designId(request.getDesignId())
                .comment(request.getComment())
                .userId(member.getMemberId())
                .userName(member.getDisplayName())
                .build());
    }

    public void relayDeleted(String sessionId, CommentDeletedRequest request) {
        relay(sessionId, request.getDesignId(), SocketEvent.COMMENT_DELETED, member -> CommentBroadcast.builder()
                .designId(request.getDesignId())
                .commentId(request.getCommentId())
                .userId(member.getMemberId())
                .userName(member.getDisplayName())
                .build());
    }

    public void relayResolved(String sessionId, CommentResolvedRequest request) {
        relay(sessionId, request.getDesignId(), SocketEvent.COMMENT_RESOLVED, member -> CommentBroadcast.builder()
                .designId(request.getDesignId())
                .commentId(request.getCommentId())
                .isResolved(request.getIsResolved())
                .userId(member.getMemberId())
                .userName(member.getDisplayName())
                .build());
    }

    private void relay(String sessionId, String designId, SocketEvent event,
                       Function<Member, CommentBroadcast> payloadFactory) {
        Optional<String> currentDesign = presenceRegistry.findDesignId(sessionId);
        if (currentDesign.isEmpty() || !currentDesign.get().equalsIgnoreCase(designId)) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }

        Optional<Relay<CommentBroadcast>> relay =
                presenceRegistry.relayFrom(sessionId, (room, member) -> payloadFactory.apply(member));
        if (relay.isEmpty()) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }

        responseSender.broadcast(relay.get().getRecipients(), event, relay.get().getPayload());
        log.debug("댓글 알림 중계: design={}, event={}", designId, event.getEventName());
    }
}
