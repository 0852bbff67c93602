package com.copyleft.CanvasSync.feature.presence.dto;

import com.copyleft.CanvasSync.domain.CursorPosition;
import com.copyleft.CanvasSync.domain.Member;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemberView {
    private String id;
    private String name;
    private String color;
    private CursorPosition cursor;

    public static MemberView from(Member member) {
        return MemberView.builder()
                .id(member.getMemberId())
                .name(member.getDisplayName())
                .color(member.getColor().getCode())
                .cursor(member.getCursor())
                .build();
    }
}
