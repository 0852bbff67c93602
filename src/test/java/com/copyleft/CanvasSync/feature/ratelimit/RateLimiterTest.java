package com.copyleft.CanvasSync.feature.ratelimit;

import com.copyleft.CanvasSync.global.constant.ClientEvent;
import com.copyleft.CanvasSync.support.MutableClock;
import com.copyleft.CanvasSync.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RateLimiterTest {

    @Mock
    private TaskScheduler taskScheduler;

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        rateLimiter = new RateLimiter(TestProperties.defaults(), taskScheduler, clock);
    }

    private int allowedCount(String connectionId, ClientEvent event, int attempts) {
        int allowed = 0;
        for (int i = 0; i < attempts; i++) {
            if (rateLimiter.allow(connectionId, event)) {
                allowed++;
            }
        }
        return allowed;
    }

    @Test
    @DisplayName("요소 연산은 윈도우당 30번까지만 허용된다")
    void mutationCeiling() {
        assertEquals(30, allowedCount("s1", ClientEvent.ELEMENT_OPERATION, 31));
        assertFalse(rateLimiter.allow("s1", ClientEvent.ELEMENT_OPERATION));
    }

    @Test
    @DisplayName("커서 이벤트는 60번, 그 외 이벤트는 100번까지 허용된다")
    void presenceAndDefaultCeilings() {
        assertEquals(60, allowedCount("s1", ClientEvent.CURSOR_MOVE, 70));
        assertEquals(100, allowedCount("s1", ClientEvent.REFRESH_SIGNAL, 120));
    }

    @Test
    @DisplayName("윈도우가 지나면 다시 허용된다")
    void windowRollover() {
        // given
        allowedCount("s1", ClientEvent.ELEMENT_OPERATION, 30);
        assertFalse(rateLimiter.allow("s1", ClientEvent.ELEMENT_OPERATION));

        // when
        clock.advance(Duration.ofSeconds(60).plusMillis(1));

        // then
        assertTrue(rateLimiter.allow("s1", ClientEvent.ELEMENT_OPERATION));
    }

    @Test
    @DisplayName("윈도우가 끝나는 시각 정각까지는 여전히 같은 윈도우다")
    void windowBoundary() {
        allowedCount("s1", ClientEvent.ELEMENT_OPERATION, 30);

        clock.advance(Duration.ofSeconds(60));

        assertFalse(rateLimiter.allow("s1", ClientEvent.ELEMENT_OPERATION));
    }

    @Test
    @DisplayName("카운터는 연결과 이벤트 종류별로 따로 관리된다")
    void independentKeys() {
        allowedCount("s1", ClientEvent.ELEMENT_OPERATION, 30);

        assertTrue(rateLimiter.allow("s2", ClientEvent.ELEMENT_OPERATION));
        assertTrue(rateLimiter.allow("s1", ClientEvent.CURSOR_MOVE));
        assertTrue(rateLimiter.allow("s1", ClientEvent.ELEMENT_DRAG_MOVE));
    }

    @Test
    @DisplayName("연결 해제 시 그 연결의 윈도우만 모두 지워진다")
    void release() {
        // given
        rateLimiter.allow("s1", ClientEvent.ELEMENT_OPERATION);
        rateLimiter.allow("s1", ClientEvent.CURSOR_MOVE);
        rateLimiter.allow("s10", ClientEvent.CURSOR_MOVE);

        // when
        rateLimiter.release("s1");

        // then
        assertEquals(1, rateLimiter.getWindowCount());
    }

    @Test
    @DisplayName("정리 작업은 만료된 윈도우만 지운다")
    void sweepExpired() {
        // given
        rateLimiter.allow("s1", ClientEvent.ELEMENT_OPERATION);
        clock.advance(Duration.ofSeconds(30));
        rateLimiter.allow("s2", ClientEvent.ELEMENT_OPERATION);
        clock.advance(Duration.ofSeconds(31));

        // when
        int removed = rateLimiter.sweepExpired();

        // then
        assertEquals(1, removed);
        assertEquals(1, rateLimiter.getWindowCount());
    }

    @Test
    @DisplayName("시작 시 윈도우 길이 주기로 정리 작업을 등록한다")
    void startSweep() {
        rateLimiter.startSweep();

        verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(60)));
    }
}
