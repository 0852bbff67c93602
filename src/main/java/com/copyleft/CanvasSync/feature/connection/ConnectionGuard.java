package com.copyleft.CanvasSync.feature.connection;

import com.copyleft.CanvasSync.config.CollaborationProperties;
import com.copyleft.CanvasSync.feature.audit.AuditLogService;
import com.copyleft.CanvasSync.global.constant.AuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 주소별 동시 연결 수 제한과 연결 최대 수명 타이머.
 * 멤버 비활성 정리(InactivityReaper)와는 별개로, 활동 여부와 상관없이 연결 자체를 끊는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionGuard {

    private static final String UNKNOWN_ADDRESS = "unknown";

    private final CollaborationProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final AuditLogService auditLogService;

    private final ConcurrentHashMap<String, Integer> connectionCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> lifetimeTimers = new ConcurrentHashMap<>();

    public boolean acceptConnection(String originAddress) {
        String address = normalize(originAddress);
        int ceiling = properties.maxConnectionsPerAddress();

        AtomicBoolean accepted = new AtomicBoolean(true);
        connectionCounts.compute(address, (k, count) -> {
            int current = count == null ? 0 : count;
            if (current >= ceiling) {
                accepted.set(false);
                return count;
            }
            return current + 1;
        });

        if (!accepted.get()) {
            log.warn("주소별 연결 수 초과: address={}, ceiling={}", address, ceiling);
            auditLogService.record(AuditEvent.CONNECTION_LIMIT_EXCEEDED, Map.of("ipAddress", address));
        }
        return accepted.get();
    }

    public void releaseConnection(String originAddress) {
        connectionCounts.computeIfPresent(normalize(originAddress), (k, count) -> count <= 1 ? null : count - 1);
    }

    public int getConnectionCount(String originAddress) {
        return connectionCounts.getOrDefault(normalize(originAddress), 0);
    }

    /**
     * 연결 수명이 다하면 onExpiry 를 실행한다 (보통 세션 강제 종료).
     */
    public void scheduleLifetimeLimit(String connectionId, Runnable onExpiry) {
        Instant deadline = clock.instant().plus(properties.connectionLifetime());

        ScheduledFuture<?> timer = taskScheduler.schedule(() -> {
            lifetimeTimers.remove(connectionId);
            log.info("연결 수명 만료, 강제 종료: {}", connectionId);
            auditLogService.record(AuditEvent.CONNECTION_TIMEOUT, Map.of("socketId", connectionId));
            onExpiry.run();
        }, deadline);

        ScheduledFuture<?> previous = lifetimeTimers.put(connectionId, timer);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    public void cancelLifetimeLimit(String connectionId) {
        ScheduledFuture<?> timer = lifetimeTimers.remove(connectionId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private String normalize(String originAddress) {
        return originAddress == null || originAddress.isBlank() ? UNKNOWN_ADDRESS : originAddress;
    }
}
