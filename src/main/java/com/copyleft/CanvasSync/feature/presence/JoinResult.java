package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import com.copyleft.CanvasSync.global.constant.ErrorCode;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class JoinResult {

    private final ErrorCode error; // null 이면 성공

    private final String designId;
    private final MemberView self;
    private final List<MemberView> roomMembers; // 본인 포함 스냅샷
    private final List<String> peerConnectionIds;
    private final Departure previousRoom; // 다른 방에서 옮겨온 경우

    public static JoinResult rejected(ErrorCode error) {
        return JoinResult.builder().error(error).build();
    }

    public boolean isJoined() {
        return error == null;
    }
}
