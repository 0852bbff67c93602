package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.config.CollaborationProperties;
import com.copyleft.CanvasSync.feature.audit.AuditLogService;
import com.copyleft.CanvasSync.feature.session.dto.UserLeftResponse;
import com.copyleft.CanvasSync.global.constant.AuditEvent;
import com.copyleft.CanvasSync.global.constant.SocketEvent;
import com.copyleft.CanvasSync.global.messaging.CollaborationResponseSender;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * 오래 활동이 없는 멤버를 방에서 내보낸다. 연결은 끊지 않으므로 클라이언트가 다시 입장해야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InactivityReaper {

    private final PresenceRegistry presenceRegistry;
    private final CollaborationResponseSender responseSender;
    private final AuditLogService auditLogService;
    private final CollaborationProperties properties;
    private final TaskScheduler taskScheduler;

    private ScheduledFuture<?> reaperTask;

    @PostConstruct
    public void start() {
        reaperTask = taskScheduler.scheduleWithFixedDelay(this::sweep, properties.reaperInterval());
        log.info("비활성 멤버 정리 시작: 주기={}, 기준={}", properties.reaperInterval(), properties.inactivityThreshold());
    }

    @PreDestroy
    public void stop() {
        if (reaperTask != null) {
            reaperTask.cancel(false);
        }
    }

    public int sweep() {
        List<Departure> departures;
        try {
            departures = presenceRegistry.reapInactive(properties.inactivityThreshold());
        } catch (Exception e) {
            log.error("비활성 멤버 정리 실패: {}", e.getMessage(), e);
            return 0;
        }

        for (Departure departure : departures) {
            responseSender.broadcast(departure.getRemainingConnectionIds(), SocketEvent.USER_LEFT,
                    UserLeftResponse.from(departure.getMember()));

            auditLogService.record(AuditEvent.INACTIVE_MEMBER_REAPED, Map.of(
                    "socketId", departure.getConnectionId(),
                    "designId", departure.getDesignId(),
                    "lastActivity", String.valueOf(departure.getLastActivityAt())));
        }

        if (!departures.isEmpty()) {
            log.info("비활성 멤버 {}명 정리", departures.size());
        }
        return departures.size();
    }
}
