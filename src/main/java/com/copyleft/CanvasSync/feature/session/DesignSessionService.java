package com.copyleft.CanvasSync.feature.session;

import com.copyleft.CanvasSync.config.CollaborationProperties;
import com.copyleft.CanvasSync.feature.audit.AuditLogService;
import com.copyleft.CanvasSync.feature.presence.Departure;
import com.copyleft.CanvasSync.feature.presence.JoinResult;
import com.copyleft.CanvasSync.feature.presence.PresenceRegistry;
import com.copyleft.CanvasSync.feature.presence.Relay;
import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import com.copyleft.CanvasSync.feature.session.dto.JoinDesignRequest;
import com.copyleft.CanvasSync.feature.session.dto.JoinedDesignResponse;
import com.copyleft.CanvasSync.feature.session.dto.LeftDesignResponse;
import com.copyleft.CanvasSync.feature.session.dto.RefreshSignalResponse;
import com.copyleft.CanvasSync.feature.session.dto.UserJoinedResponse;
import com.copyleft.CanvasSync.feature.session.dto.UserLeftResponse;
import com.copyleft.CanvasSync.global.constant.AuditEvent;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import com.copyleft.CanvasSync.global.util.SanitizeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DesignSessionService {

    private static final String DEFAULT_NAME_PREFIX = "User ";

    private final PresenceRegistry presenceRegistry;
    private final CollaborationResponseSender responseSender;
    private final AuditLogService auditLogService;
    private final CollaborationProperties properties;

    public void joinDesign(String sessionId, JoinDesignRequest request) {
        String displayName = SanitizeUtil.sanitizeDisplayName(
                request.getUserName(), defaultDisplayName(sessionId), properties.maxDisplayNameLength());

        JoinResult result = presenceRegistry.join(sessionId, request.getDesignId(), displayName);

        if (!result.isJoined()) {
            if (result.getError() == ErrorCode.ROOM_FULL) {
                auditLogService.record(AuditEvent.ROOM_SIZE_LIMIT_EXCEEDED, Map.of(
                        "socketId", sessionId,
                        "designId", request.getDesignId(),
                        "maxSize", properties.maxRoomMembers()));
            }
            responseSender.sendError(sessionId, result.getError());
            return;
        }

        if (result.getPreviousRoom() != null) {
            broadcastUserLeft(result.getPreviousRoom());
        }

        MemberView self = result.getSelf();
        responseSender.send(sessionId, SocketEvent.JOINED_DESIGN, JoinedDesignResponse.builder()
                .designId(result.getDesignId())
                .userId(self.getId())
                .userName(self.getName())
                .userColor(self.getColor())
                .roomUsers(result.getRoomMembers())
                .build());

        responseSender.broadcast(result.getPeerConnectionIds(), SocketEvent.USER_JOINED, UserJoinedResponse.builder()
                .userId(self.getId())
                .userName(self.getName())
                .userColor(self.getColor())
                .build());
    }

    public void leaveDesign(String sessionId) {
        Optional<Departure> departure = presenceRegistry.leave(sessionId);
        if (departure.isEmpty()) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }

        responseSender.send(sessionId, SocketEvent.LEFT_DESIGN, LeftDesignResponse.builder()
                .designId(departure.get().getDesignId())
                .build());
        broadcastUserLeft(departure.get());
    }

    /**
     * 연결 종료 시 호출. 방에 없던 연결이면 아무 일도 하지 않는다.
     */
    public void handleDisconnect(String sessionId) {
        presenceRegistry.leave(sessionId).ifPresent(this::broadcastUserLeft);
    }

    public void refreshSignal(String sessionId) {
        Optional<Relay<RefreshSignalResponse>> relay = presenceRegistry.relayFrom(sessionId, (designId, member) ->
                RefreshSignalResponse.builder()
                        .designId(designId)
                        .userId(member.getMemberId())
                        .userName(member.getDisplayName())
                        .build());

        if (relay.isEmpty()) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }
        responseSender.broadcast(relay.get().getRecipients(), SocketEvent.REFRESH_SIGNAL, relay.get().getPayload());
    }

    public void broadcastUserLeft(Departure departure) {
        responseSender.broadcast(departure.getRemainingConnectionIds(), SocketEvent.USER_LEFT,
                UserLeftResponse.from(departure.getMember()));
        log.info("디자인 퇴장: design={}, member={}", departure.getDesignId(), departure.getMember().getId());
    }

    private String defaultDisplayName(String sessionId) {
        String suffix = sessionId.length() > 4 ? sessionId.substring(sessionId.length() - 4) : sessionId;
        return DEFAULT_NAME_PREFIX + suffix;
    }
}
