package com.copyleft.CanvasSync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "collab")
public record CollaborationProperties(
        // 방 설정
        int maxRoomMembers,          // 방 하나의 최대 인원 (기본 50명)
        int maxDisplayNameLength,    // 표시 이름 최대 길이

        // 속도 제한 (윈도우 단위)
        Duration rateLimitWindow,    // 윈도우 길이 (기본 60초)
        int presenceEventsPerWindow, // 커서/드래그/선택 이벤트 한도
        int mutationEventsPerWindow, // 요소 변경 이벤트 한도
        int defaultEventsPerWindow,  // 그 외 이벤트 한도

        // 연결 제한
        int maxConnectionsPerAddress, // 주소당 동시 연결 수
        Duration connectionLifetime,  // 연결 최대 유지 시간 (기본 30분)

        // 비활성 멤버 정리
        Duration inactivityThreshold, // 이 시간 동안 활동 없으면 퇴장 처리
        Duration reaperInterval       // 정리 주기
) {}
