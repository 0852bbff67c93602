package com.copyleft.CanvasSync.feature.presence.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class RoomPresenceResponse {
    private String designId;
    private List<MemberView> members;
}
