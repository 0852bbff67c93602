package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class Departure {
    private final String designId;
    private final String connectionId;
    private final MemberView member;
    private final Instant lastActivityAt;
    private final List<String> remainingConnectionIds;
}
