package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.config.CollaborationProperties;
import com.copyleft.CanvasSync.domain.CursorPosition;
import com.copyleft.CanvasSync.domain.Member;
import com.copyleft.CanvasSync.domain.Room;
import com.copyleft.CanvasSync.feature.element.dto.ElementOperationBroadcast;
import com.copyleft.CanvasSync.feature.element.dto.ElementOperationRequest;
import com.copyleft.CanvasSync.feature.presence.dto.CursorBroadcast;
import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import com.copyleft.CanvasSync.feature.presence.dto.SelectionBroadcast;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.global.util.RandomUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Pattern;

/**
 * 방/멤버 상태의 유일한 변경 지점. 모든 연산은 이 인스턴스 단위로 직렬화된다.
 * <p>
 * 연결 상태: 미입장 -> 입장(designId) -> 미입장 (퇴장, 연결 종료, 비활성 정리)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceRegistry {

    private static final Pattern DESIGN_ID = Pattern.compile(ValidationPatterns.DESIGN_ID);

    private final CollaborationProperties properties;
    private final Clock clock;

    private final Map<String, Room> rooms = new HashMap<>();
    private final Map<String, String> connectionRooms = new HashMap<>(); // connectionId -> designId

    public synchronized JoinResult join(String connectionId, String designId, String displayName) {
        if (designId == null || !DESIGN_ID.matcher(designId).matches()) {
            return JoinResult.rejected(ErrorCode.VALIDATION_ERROR);
        }

        Room target = rooms.get(designId);
        if (target != null && !target.hasMember(connectionId) && target.isFull(properties.maxRoomMembers())) {
            log.warn("방 정원 초과: design={}, size={}", designId, target.size());
            return JoinResult.rejected(ErrorCode.ROOM_FULL);
        }

        Departure previous = leaveInternal(connectionId).orElse(null);

        Instant now = clock.instant();
        Room room = rooms.computeIfAbsent(designId, Room::new);
        Member member = Member.create(
                RandomUtil.generateMemberId(now.toEpochMilli()),
                displayName,
                room.getNextAvailableColor(),
                connectionId,
                now);
        room.addMember(member);
        connectionRooms.put(connectionId, designId);

        log.info("디자인 입장: design={}, member={}, size={}", designId, member.getMemberId(), room.size());

        return JoinResult.builder()
                .designId(designId)
                .self(MemberView.from(member))
                .roomMembers(snapshot(room))
                .peerConnectionIds(room.getConnectionIdsExcept(connectionId))
                .previousRoom(previous)
                .build();
    }

    public synchronized Optional<Departure> leave(String connectionId) {
        return leaveInternal(connectionId);
    }

    /**
     * 활동 시각만 갱신한다. 방에 없는 연결이면 아무 일도 없다.
     */
    public synchronized void touch(String connectionId) {
        Member member = findMemberInternal(connectionId);
        if (member != null) {
            member.touch(clock.instant());
        }
    }

    public synchronized Optional<Relay<CursorBroadcast>> updateCursor(String connectionId, double x, double y) {
        Member member = findMemberInternal(connectionId);
        if (member == null) {
            return Optional.empty();
        }
        member.moveCursor(new CursorPosition(x, y), clock.instant());
        return Optional.of(relayOf(member, CursorBroadcast.builder()
                .userId(member.getMemberId())
                .userName(member.getDisplayName())
                .userColor(member.getColor().getCode())
                .cursor(member.getCursor())
                .build()));
    }

    public synchronized Optional<Relay<SelectionBroadcast>> updateSelection(String connectionId, String elementId) {
        Member member = findMemberInternal(connectionId);
        if (member == null) {
            return Optional.empty();
        }
        member.select(elementId, clock.instant());
        return Optional.of(relayOf(member, SelectionBroadcast.builder()
                .userId(member.getMemberId())
                .userName(member.getDisplayName())
                .userColor(member.getColor().getCode())
                .elementId(elementId)
                .build()));
    }

    /**
     * 보낸 멤버 ID 와 서버 시각을 붙인다. timestamp/version 은 순서 힌트일 뿐 충돌 해결에 쓰면 안 된다.
     */
    public synchronized Optional<Relay<ElementOperationBroadcast>> relayOperation(String connectionId,
                                                                                  ElementOperationRequest operation) {
        Member member = findMemberInternal(connectionId);
        if (member == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        member.touch(now);
        return Optional.of(relayOf(member,
                ElementOperationBroadcast.of(operation, member.getMemberId(), now.toEpochMilli())));
    }

    /**
     * 보낸 멤버의 활동 시각을 갱신하고, (designId, 멤버)로 만든 페이로드를 같은 방의 다른 멤버에게 보낼 준비를 한다.
     */
    public synchronized <T> Optional<Relay<T>> relayFrom(String connectionId,
                                                         BiFunction<String, Member, T> payloadFactory) {
        Member member = findMemberInternal(connectionId);
        if (member == null) {
            return Optional.empty();
        }
        member.touch(clock.instant());
        return Optional.of(relayOf(member, payloadFactory.apply(connectionRooms.get(connectionId), member)));
    }

    public synchronized List<Departure> reapInactive(Duration threshold) {
        Instant now = clock.instant();
        List<String> stale = new ArrayList<>();
        for (Room room : rooms.values()) {
            for (Member member : room.getMemberList()) {
                if (member.isInactive(now, threshold)) {
                    stale.add(member.getConnectionId());
                }
            }
        }

        List<Departure> departures = new ArrayList<>(stale.size());
        for (String connectionId : stale) {
            leaveInternal(connectionId).ifPresent(departures::add);
        }
        return departures;
    }

    public synchronized Optional<String> findDesignId(String connectionId) {
        return Optional.ofNullable(connectionRooms.get(connectionId));
    }

    public synchronized Optional<List<MemberView>> findRoomMembers(String designId) {
        return Optional.ofNullable(rooms.get(designId)).map(this::snapshot);
    }

    public synchronized int getRoomCount() {
        return rooms.size();
    }

    public synchronized int getMemberCount() {
        return connectionRooms.size();
    }

    private Optional<Departure> leaveInternal(String connectionId) {
        String designId = connectionRooms.remove(connectionId);
        if (designId == null) {
            return Optional.empty();
        }

        Room room = rooms.get(designId);
        Member member = room != null ? room.removeMember(connectionId) : null;
        if (room == null || member == null) {
            log.warn("연결-방 매핑은 있었지만 멤버가 없음: connection={}, design={}", connectionId, designId);
            return Optional.empty();
        }

        if (room.isEmpty()) {
            rooms.remove(designId);
            log.info("빈 방 삭제: {}", designId);
        }

        return Optional.of(Departure.builder()
                .designId(designId)
                .connectionId(connectionId)
                .member(MemberView.from(member))
                .lastActivityAt(member.getLastActivityAt())
                .remainingConnectionIds(room.getConnectionIdsExcept(connectionId))
                .build());
    }

    private Member findMemberInternal(String connectionId) {
        String designId = connectionRooms.get(connectionId);
        if (designId == null) {
            return null;
        }
        Room room = rooms.get(designId);
        return room != null ? room.getMember(connectionId) : null;
    }

    private <T> Relay<T> relayOf(Member member, T payload) {
        Room room = rooms.get(connectionRooms.get(member.getConnectionId()));
        return new Relay<>(room.getConnectionIdsExcept(member.getConnectionId()), payload);
    }

    private List<MemberView> snapshot(Room room) {
        List<MemberView> views = new ArrayList<>(room.size());
        for (Member member : room.getMemberList()) {
            views.add(MemberView.from(member));
        }
        return views;
    }
}
