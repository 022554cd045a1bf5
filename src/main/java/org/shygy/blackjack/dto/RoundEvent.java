package org.shygy.blackjack.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class RoundEvent {
    private String type;
    private Map<String, Object> payload;
}
