package org.dicepool.dto.dice;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class DiceEventMessage {
    private long eventId;
    private Long roundId;
    private String type;
    private Map<String, Object> payload;
    private String createdAt;
}
