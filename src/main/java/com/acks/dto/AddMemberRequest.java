package com.acks.dto;

import com.acks.model.MemberRole;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddMemberRequest {

    @NotBlank
    private String characterId;

    private MemberRole role = MemberRole.MEMBER;
}
