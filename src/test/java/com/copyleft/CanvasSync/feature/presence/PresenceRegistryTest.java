package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.element.dto.ElementOperationBroadcast;
import com.copyleft.CanvasSync.feature.element.dto.ElementOperationRequest;
import com.copyleft.CanvasSync.feature.presence.dto.CursorBroadcast;
import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import com.copyleft.CanvasSync.support.MutableClock;
import com.copyleft.CanvasSync.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PresenceRegistryTest {

    private static final String DESIGN_A = "507f1f77bcf86cd799439011";
    private static final String DESIGN_B = "507f1f77bcf86cd799439022";
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private PresenceRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        registry = new PresenceRegistry(TestProperties.withMaxRoomMembers(3), clock);
    }

    @Test
    @DisplayName("첫 입장 시 방이 만들어지고 본인만 있는 스냅샷을 받는다")
    void join_CreatesRoom() {
        // when
        JoinResult result = registry.join("s1", DESIGN_A, "alice");

        // then
        assertTrue(result.isJoined());
        assertEquals(1, registry.getRoomCount());
        assertEquals(1, result.getRoomMembers().size());
        assertEquals("alice", result.getSelf().getName());
        assertTrue(result.getSelf().getId().startsWith("user_" + START.toEpochMilli() + "_"));
        assertTrue(result.getPeerConnectionIds().isEmpty());
        assertNull(result.getPreviousRoom());
    }

    @Test
    @DisplayName("두 번째 입장자는 기존 멤버를 포함한 스냅샷을 받고, 기존 멤버가 알림 대상이 된다")
    void join_SecondMember() {
        // given
        registry.join("s1", DESIGN_A, "alice");

        // when
        JoinResult result = registry.join("s2", DESIGN_A, "bob");

        // then
        assertEquals(List.of("alice", "bob"), result.getRoomMembers().stream().map(MemberView::getName).toList());
        assertEquals(List.of("s1"), result.getPeerConnectionIds());
        assertNotEquals(result.getRoomMembers().get(0).getColor(), result.getSelf().getColor());
    }

    @Test
    @DisplayName("형식이 틀린 디자인 ID 로는 방이 만들어지지 않는다")
    void join_MalformedDesignId() {
        // when
        JoinResult result = registry.join("s1", "xyz", "alice");

        // then
        assertFalse(result.isJoined());
        assertEquals(ErrorCode.VALIDATION_ERROR, result.getError());
        assertEquals(0, registry.getRoomCount());
    }

    @Test
    @DisplayName("정원이 찬 방에 들어가려 하면 거절되고, 원래 있던 방은 그대로 유지된다")
    void join_RoomFull_KeepsPreviousMembership() {
        // given
        registry.join("s1", DESIGN_A, "a");
        registry.join("s2", DESIGN_A, "b");
        registry.join("s3", DESIGN_A, "c");
        registry.join("s4", DESIGN_B, "d");

        // when
        JoinResult result = registry.join("s4", DESIGN_A, "d");

        // then
        assertEquals(ErrorCode.ROOM_FULL, result.getError());
        assertEquals(Optional.of(DESIGN_B), registry.findDesignId("s4"));
        assertEquals(3, registry.findRoomMembers(DESIGN_A).orElseThrow().size());
    }

    @Test
    @DisplayName("이미 들어가 있는 방에 다시 입장하면 정원이 차 있어도 거절되지 않는다")
    void join_SameRoomWhenFull() {
        // given
        registry.join("s1", DESIGN_A, "a");
        registry.join("s2", DESIGN_A, "b");
        registry.join("s3", DESIGN_A, "c");

        // when
        JoinResult result = registry.join("s3", DESIGN_A, "c2");

        // then
        assertTrue(result.isJoined());
        assertNotNull(result.getPreviousRoom());
        assertEquals(3, registry.findRoomMembers(DESIGN_A).orElseThrow().size());
        assertEquals(3, registry.getMemberCount());
    }

    @Test
    @DisplayName("다른 방으로 옮기면 이전 방 퇴장 정보가 함께 오고, 빈 방은 삭제된다")
    void join_MovesRooms() {
        // given
        registry.join("s1", DESIGN_A, "alice");

        // when
        JoinResult result = registry.join("s1", DESIGN_B, "alice");

        // then
        Departure previous = result.getPreviousRoom();
        assertNotNull(previous);
        assertEquals(DESIGN_A, previous.getDesignId());
        assertTrue(registry.findRoomMembers(DESIGN_A).isEmpty());
        assertEquals(1, registry.getRoomCount());
    }

    @Test
    @DisplayName("퇴장하면 남은 멤버 목록을 돌려주고, 방에 없으면 빈 값이다")
    void leave() {
        // given
        registry.join("s1", DESIGN_A, "alice");
        registry.join("s2", DESIGN_A, "bob");

        // when
        Optional<Departure> departure = registry.leave("s1");

        // then
        assertTrue(departure.isPresent());
        assertEquals("alice", departure.get().getMember().getName());
        assertEquals(List.of("s2"), departure.get().getRemainingConnectionIds());
        assertEquals(1, registry.getRoomCount());
        assertTrue(registry.leave("s1").isEmpty());
        assertTrue(registry.leave("nobody").isEmpty());
    }

    @Test
    @DisplayName("커서 이동은 보낸 사람을 뺀 같은 방 멤버에게만 전달된다")
    void updateCursor() {
        // given
        registry.join("s1", DESIGN_A, "alice");
        registry.join("s2", DESIGN_A, "bob");
        registry.join("s3", DESIGN_B, "carol");

        // when
        Optional<Relay<CursorBroadcast>> relay = registry.updateCursor("s1", 12.5, -40);

        // then
        assertTrue(relay.isPresent());
        assertEquals(List.of("s2"), relay.get().getRecipients());
        assertEquals(12.5, relay.get().getPayload().getCursor().getX());
        assertEquals("alice", relay.get().getPayload().getUserName());
        assertTrue(registry.updateCursor("unjoined", 0, 0).isEmpty());
    }

    @Test
    @DisplayName("요소 연산에는 서버 시각이 붙고, 버전이 없으면 시각이 버전이 된다")
    void relayOperation_VersionFallback() {
        // given
        registry.join("s1", DESIGN_A, "alice");
        ElementOperationRequest operation = ElementOperationRequest.builder()
                .type("element_moved")
                .designId(DESIGN_A)
                .elementId("rect_1")
                .build();

        // when
        ElementOperationBroadcast broadcast = registry.relayOperation("s1", operation).orElseThrow().getPayload();

        // then
        assertEquals(START.toEpochMilli(), broadcast.getTimestamp());
        assertEquals(START.toEpochMilli(), broadcast.getVersion());
        assertTrue(broadcast.getUserId().startsWith("user_"));
    }

    @Test
    @DisplayName("버전이 주어지면 그대로 전달한다")
    void relayOperation_GivenVersion() {
        registry.join("s1", DESIGN_A, "alice");
        ElementOperationRequest operation = ElementOperationRequest.builder()
                .type("element_updated")
                .designId(DESIGN_A)
                .elementId("rect_1")
                .version(7L)
                .build();

        assertEquals(7L, registry.relayOperation("s1", operation).orElseThrow().getPayload().getVersion());
    }

    @Test
    @DisplayName("기준 시간 넘게 활동이 없는 멤버만 정리된다")
    void reapInactive() {
        // given
        registry.join("s1", DESIGN_A, "alice");
        registry.join("s2", DESIGN_A, "bob");
        clock.advance(Duration.ofMinutes(4));
        registry.touch("s2");
        clock.advance(Duration.ofMinutes(1).plusSeconds(1));

        // when
        List<Departure> departures = registry.reapInactive(Duration.ofMinutes(5));

        // then
        assertEquals(1, departures.size());
        assertEquals("s1", departures.get(0).getConnectionId());
        assertEquals(List.of("s2"), departures.get(0).getRemainingConnectionIds());
        assertTrue(registry.findDesignId("s1").isEmpty());
        assertEquals(1, registry.getMemberCount());
    }

    @Test
    @DisplayName("커서 이동도 활동으로 인정된다")
    void cursorCountsAsActivity() {
        registry.join("s1", DESIGN_A, "alice");
        clock.advance(Duration.ofMinutes(4));
        registry.updateCursor("s1", 1, 1);
        clock.advance(Duration.ofMinutes(4));

        assertTrue(registry.reapInactive(Duration.ofMinutes(5)).isEmpty());

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        assertEquals(1, registry.reapInactive(Duration.ofMinutes(5)).size());
    }
}
