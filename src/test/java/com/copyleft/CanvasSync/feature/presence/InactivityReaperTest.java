package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.audit.AuditLogService;
import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import com.copyleft.CanvasSync.feature.session.dto.UserLeftResponse;
import com.copyleft.CanvasSync.global.constant.AuditEvent;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import com.copyleft.CanvasSync.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InactivityReaperTest {

    @Mock private PresenceRegistry presenceRegistry;
    @Mock private CollaborationResponseSender responseSender;
    @Mock private AuditLogService auditLogService;
    @Mock private TaskScheduler taskScheduler;

    private InactivityReaper inactivityReaper;

    @BeforeEach
    void setUp() {
        inactivityReaper = new InactivityReaper(
                presenceRegistry, responseSender, auditLogService, TestProperties.defaults(), taskScheduler);
    }

    @Test
    @DisplayName("정리된 멤버마다 남은 멤버에게 user_left 를 보내고 감사 로그를 남긴다")
    void sweep_BroadcastsAndAudits() {
        // given
        Departure departure = Departure.builder()
                .designId("507f1f77bcf86cd799439011")
                .connectionId("s1")
                .member(MemberView.builder().id("user_1_abc").name("alice").color("#FF6B6B").build())
                .lastActivityAt(Instant.parse("2025-01-01T00:00:00Z"))
                .remainingConnectionIds(List.of("s2", "s3"))
                .build();
        when(presenceRegistry.reapInactive(Duration.ofMinutes(5))).thenReturn(List.of(departure));

        // when
        int reaped = inactivityReaper.sweep();

        // then
        assertEquals(1, reaped);

        ArgumentCaptor<Object> dataCaptor = ArgumentCaptor.forClass(Object.class);
        verify(responseSender).broadcast(eq(List.of("s2", "s3")), eq(SocketEvent.USER_LEFT), dataCaptor.capture());
        UserLeftResponse data = (UserLeftResponse) dataCaptor.getValue();
        assertEquals("user_1_abc", data.getUserId());
        assertEquals("alice", data.getUserName());

        ArgumentCaptor<Map<String, ?>> detailCaptor = ArgumentCaptor.forClass(Map.class);
        verify(auditLogService).record(eq(AuditEvent.INACTIVE_MEMBER_REAPED), detailCaptor.capture());
        assertEquals("s1", detailCaptor.getValue().get("socketId"));
    }

    @Test
    @DisplayName("정리할 멤버가 없으면 아무것도 보내지 않는다")
    void sweep_NothingToReap() {
        when(presenceRegistry.reapInactive(any(Duration.class))).thenReturn(List.of());

        assertEquals(0, inactivityReaper.sweep());

        verifyNoInteractions(responseSender, auditLogService);
    }

    @Test
    @DisplayName("레지스트리 오류가 나도 예외를 밖으로 던지지 않는다")
    void sweep_RegistryFailure() {
        when(presenceRegistry.reapInactive(any(Duration.class))).thenThrow(new IllegalStateException("boom"));

        assertEquals(0, inactivityReaper.sweep());

        verify(auditLogService, never()).record(any(), anyMap());
    }

    @Test
    @DisplayName("시작 시 정리 주기로 작업을 등록한다")
    void start_SchedulesSweep() {
        inactivityReaper.start();

        verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(60)));
    }
}
