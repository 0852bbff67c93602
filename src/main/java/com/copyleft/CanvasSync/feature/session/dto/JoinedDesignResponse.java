package com.copyleft.CanvasSync.feature.session.dto;

import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class JoinedDesignResponse {
    private String designId;
    private String userId;
    private String userName;
    private String userColor;
    private List<MemberView> roomUsers; // 본인 포함 현재 멤버 전체
}
