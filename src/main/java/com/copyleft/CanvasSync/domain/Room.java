package com.copyleft.CanvasSync.domain;

import com.copyleft.CanvasSync.domain.type.MemberColor;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Getter
@ToString
public class Room {

    private final String designId;

    // connectionId -> Member (입장 순서 유지)
    private final Map<String, Member> members = new LinkedHashMap<>();

    public Room(String designId) {
        this.designId = designId;
    }

    public void addMember(Member member) {
        members.put(member.getConnectionId(), member);
    }

    public Member removeMember(String connectionId) {
        return members.remove(connectionId);
    }

    public Member getMember(String connectionId) {
        return members.get(connectionId);
    }

    public boolean hasMember(String connectionId) {
        return members.containsKey(connectionId);
    }

    public Collection<Member> getMemberList() {
        return Collections.unmodifiableCollection(members.values());
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean isFull(int maxMembers) {
        return members.size() >= maxMembers;
    }

    public List<String> getConnectionIdsExcept(String connectionId) {
        List<String> result = new ArrayList<>(members.size());
        for (String id : members.keySet()) {
            if (!Objects.equals(id, connectionId)) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * 아직 아무도 쓰지 않은 색을 팔레트 순서대로 고른다. 모두 사용 중이면 가장 적게 쓰인 색.
     */
    public MemberColor getNextAvailableColor() {
        Map<MemberColor, Integer> usage = new EnumMap<>(MemberColor.class);
        for (MemberColor color : MemberColor.values()) {
            usage.put(color, 0);
        }
        for (Member member : members.values()) {
            usage.merge(member.getColor(), 1, Integer::sum);
        }

        MemberColor selected = MemberColor.values()[0];
        for (MemberColor color : MemberColor.values()) {
            if (usage.get(color) < usage.get(selected)) {
                selected = color;
            }
        }
        return selected;
    }
}
