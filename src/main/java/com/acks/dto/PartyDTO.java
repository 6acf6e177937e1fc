package com.acks.dto;

import com.acks.model.MemberRole;
import com.acks.model.Party;
import com.acks.model.PartyMember;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartyDTO {
    private String id;
    private String name;
    private long pendingXp;
    private List<Member> members;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Member {
        private String characterId;
        private MemberRole role;
    }

    public static PartyDTO from(Party party) {
        return PartyDTO.builder()
                .id(party.getId())
                .name(party.getName())
                .pendingXp(party.getPendingXp())
                .members(party.getMembers().stream()
                        .sorted(Comparator.comparing(PartyMember::getCharacterId))
                        .map(m -> new Member(m.getCharacterId(), m.getRole()))
                        .toList())
                .build();
    }
}
