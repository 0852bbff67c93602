package com.copyleft.CanvasSync.domain;

import com.copyleft.CanvasSync.domain.type.MemberColor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

@Getter
@Builder
@ToString
public class Member {

    private final String memberId;     // 서버가 발급한 ID (연결 동안 고정)
    private final String displayName;  // 정제된 표시 이름
    private final MemberColor color;
    private final String connectionId; // 웹소켓 세션 ID
    private final Instant joinedAt;

    private Instant lastActivityAt;
    private CursorPosition cursor;
    private String selectedElementId;

    public static Member create(String memberId, String displayName, MemberColor color,
                                String connectionId, Instant now) {
        return Member.builder()
                .memberId(memberId)
                .displayName(displayName)
                .color(color)
                .connectionId(connectionId)
                .joinedAt(now)
                .lastActivityAt(now)
                .build();
    }

    // 시계가 뒤로 가도 활동 시각은 줄어들지 않는다
    public void touch(Instant now) {
        if (lastActivityAt == null || now.isAfter(lastActivityAt)) {
            lastActivityAt = now;
        }
    }

    public void moveCursor(CursorPosition position, Instant now) {
        this.cursor = position;
        touch(now);
    }

    public void select(String elementId, Instant now) {
        this.selectedElementId = elementId;
        touch(now);
    }

    public boolean isInactive(Instant now, Duration threshold) {
        return Duration.between(lastActivityAt, now).compareTo(threshold) > 0;
    }
}
