package com.copyleft.CanvasSync.feature.connection;

import com.copyleft.CanvasSync.feature.audit.AuditLogService;
import com.copyleft.CanvasSync.global.constant.AuditEvent;
import com.copyleft.CanvasSync.support.MutableClock;
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
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionGuardTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock private TaskScheduler taskScheduler;
    @Mock private AuditLogService auditLogService;
    @Mock private ScheduledFuture<Object> timer;

    private ConnectionGuard connectionGuard;

    @BeforeEach
    void setUp() {
        connectionGuard = new ConnectionGuard(TestProperties.defaults(), taskScheduler, new MutableClock(NOW), auditLogService);
    }

    @Test
    @DisplayName("같은 주소에서 10개까지 연결을 받고 11번째는 거절한다")
    void acceptConnection_Ceiling() {
        // given
        for (int i = 0; i < 10; i++) {
            assertTrue(connectionGuard.acceptConnection("10.0.0.1"));
        }

        // when
        boolean accepted = connectionGuard.acceptConnection("10.0.0.1");

        // then
        assertFalse(accepted);
        assertEquals(10, connectionGuard.getConnectionCount("10.0.0.1"));
        verify(auditLogService).record(eq(AuditEvent.CONNECTION_LIMIT_EXCEEDED), anyMap());
        assertTrue(connectionGuard.acceptConnection("10.0.0.2"), "다른 주소는 영향을 받지 않아야 합니다.");
    }

    @Test
    @DisplayName("연결이 끊기면 자리가 생기고, 0이 되면 카운트가 사라진다")
    void releaseConnection() {
        // given
        for (int i = 0; i < 10; i++) {
            connectionGuard.acceptConnection("10.0.0.1");
        }

        // when
        connectionGuard.releaseConnection("10.0.0.1");

        // then
        assertTrue(connectionGuard.acceptConnection("10.0.0.1"));

        for (int i = 0; i < 10; i++) {
            connectionGuard.releaseConnection("10.0.0.1");
        }
        assertEquals(0, connectionGuard.getConnectionCount("10.0.0.1"));
        connectionGuard.releaseConnection("10.0.0.1");
        assertEquals(0, connectionGuard.getConnectionCount("10.0.0.1"));
    }

    @Test
    @DisplayName("주소를 알 수 없는 연결은 unknown 으로 묶어서 센다")
    void unknownAddress() {
        connectionGuard.acceptConnection(null);
        connectionGuard.acceptConnection(" ");

        assertEquals(2, connectionGuard.getConnectionCount("unknown"));
    }

    @Test
    @DisplayName("수명 타이머는 30분 뒤로 예약되고, 만료되면 감사 로그를 남기고 종료 동작을 실행한다")
    void scheduleLifetimeLimit() {
        // given
        doReturn(timer).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        AtomicBoolean closed = new AtomicBoolean(false);

        // when
        connectionGuard.scheduleLifetimeLimit("s1", () -> closed.set(true));

        // then
        ArgumentCaptor<Runnable> taskCaptor = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(taskCaptor.capture(), eq(NOW.plus(Duration.ofMinutes(30))));

        taskCaptor.getValue().run();
        assertTrue(closed.get());
        verify(auditLogService).record(eq(AuditEvent.CONNECTION_TIMEOUT), anyMap());
    }

    @Test
    @DisplayName("연결이 먼저 끊기면 수명 타이머를 취소한다")
    void cancelLifetimeLimit() {
        // given
        doReturn(timer).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        connectionGuard.scheduleLifetimeLimit("s1", () -> { });

        // when
        connectionGuard.cancelLifetimeLimit("s1");
        connectionGuard.cancelLifetimeLimit("s1");

        // then
        verify(timer, times(1)).cancel(false);
    }
}
