package com.copyleft.CanvasSync.feature.ratelimit;

import com.copyleft.CanvasSync.config.CollaborationProperties;
import com.copyleft.CanvasSync.domain.RateWindow;
import com.copyleft.CanvasSync.global.constant.ClientEvent;
import com.copyleft.CanvasSync.global.constant.RateLimitClass;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * (연결, 이벤트) 단위 고정 윈도우 카운터. 윈도우의 첫 이벤트가 카운트를 1로 초기화하고,
 * 한도에 도달하면 윈도우가 끝날 때까지 거절한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimiter {

    private final CollaborationProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();

    private ScheduledFuture<?> sweepTask;

    @PostConstruct
    public void startSweep() {
        sweepTask = taskScheduler.scheduleWithFixedDelay(this::sweepExpired, properties.rateLimitWindow());
        log.info("속도 제한 윈도우 정리 시작: 주기={}", properties.rateLimitWindow());
    }

    @PreDestroy
    public void stopSweep() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
    }

    public boolean allow(String connectionId, ClientEvent event) {
        String key = makeKey(connectionId, event);
        int ceiling = ceilingOf(event.getRateLimitClass());
        long windowMillis = properties.rateLimitWindow().toMillis();
        long now = clock.millis();

        AtomicBoolean allowed = new AtomicBoolean(true);
        windows.compute(key, (k, window) -> {
            if (window == null || window.isExpired(now)) {
                return RateWindow.open(k, now, windowMillis);
            }
            allowed.set(window.tryIncrement(ceiling));
            return window;
        });

        if (!allowed.get()) {
            log.debug("속도 제한 초과: key={}, ceiling={}", key, ceiling);
        }
        return allowed.get();
    }

    /**
     * 연결이 끊기면 그 연결의 윈도우를 모두 버린다.
     */
    public void release(String connectionId) {
        String prefix = connectionId + ":";
        windows.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public int sweepExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.values().removeIf(window -> window.isExpired(now));
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("만료된 속도 제한 윈도우 정리: {}개", removed);
        }
        return Math.max(removed, 0);
    }

    public int getWindowCount() {
        return windows.size();
    }

    private int ceilingOf(RateLimitClass rateLimitClass) {
        switch (rateLimitClass) {
            case PRESENCE:
                return properties.presenceEventsPerWindow();
            case MUTATION:
                return properties.mutationEventsPerWindow();
            default:
                return properties.defaultEventsPerWindow();
        }
    }

    private String makeKey(String connectionId, ClientEvent event) {
        return connectionId + ":" + event.getEventName();
    }
}
