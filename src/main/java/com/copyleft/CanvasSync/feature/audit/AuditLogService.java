package com.copyleft.CanvasSync.feature.audit;

import com.copyleft.CanvasSync.global.constant.AuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 보안 관련 사건을 AUDIT 로거로 남긴다. 쓰기 전용.
 */
@Slf4j
@Service
public class AuditLogService {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    @Async
    public void record(AuditEvent event, Map<String, ?> details) {
        try {
            AUDIT.warn("[SECURITY] {} {}", event, details);
        } catch (Exception e) {
            log.error("감사 로그 기록 실패: event={}, msg={}", event, e.getMessage(), e);
        }
    }
}
