package com.copyleft.CanvasSync.feature.session.dto;

import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class UserLeftResponse {
    private String userId;
    private String userName;

    public static UserLeftResponse from(MemberView member) {
        return UserLeftResponse.builder()
                .userId(member.getId())
                .userName(member.getName())
                .build();
    }
}
