package com.acks.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * XP shares to move from a party's pending pool into members' banked XP, keyed by character id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllocateXpRequest {

    @NotEmpty
    private Map<String, Long> distribution = new LinkedHashMap<>();
}
