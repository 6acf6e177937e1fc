package com.acks.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatePartyRequest {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_-]+")
    private String id;

    @NotBlank
    private String name;
}
