package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.presence.dto.CursorBroadcast;
import com.copyleft.CanvasSync.feature.presence.dto.PresenceSummaryResponse;
import com.copyleft.CanvasSync.feature.presence.dto.RoomPresenceResponse;
import com.copyleft.CanvasSync.feature.presence.dto.SelectionBroadcast;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 커서/선택 같은 가벼운 상태 공유. 방에 없는 연결이 보낸 이벤트는 조용히 버린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final PresenceRegistry presenceRegistry;
    private final CollaborationResponseSender responseSender;

    public void moveCursor(String sessionId, double x, double y) {
        Optional<Relay<CursorBroadcast>> relay = presenceRegistry.updateCursor(sessionId, x, y);
        if (relay.isEmpty()) {
            log.debug("방에 없는 연결의 커서 이벤트 무시: {}", sessionId);
            return;
        }
        responseSender.broadcast(relay.get().getRecipients(), SocketEvent.CURSOR_MOVE, relay.get().getPayload());
    }

    public void changeSelection(String sessionId, String elementId) {
        Optional<Relay<SelectionBroadcast>> relay = presenceRegistry.updateSelection(sessionId, elementId);
        if (relay.isEmpty()) {
            log.debug("방에 없는 연결의 선택 이벤트 무시: {}", sessionId);
            return;
        }
        responseSender.broadcast(relay.get().getRecipients(), SocketEvent.USER_SELECTION, relay.get().getPayload());
    }

    public PresenceSummaryResponse getSummary() {
        return PresenceSummaryResponse.builder()
                .rooms(presenceRegistry.getRoomCount())
                .members(presenceRegistry.getMemberCount())
                .build();
    }

    public Optional<RoomPresenceResponse> getRoomPresence(String designId) {
        return presenceRegistry.findRoomMembers(designId)
                .map(members -> RoomPresenceResponse.builder()
                        .designId(designId)
                        .members(members)
                        .build());
    }
}
