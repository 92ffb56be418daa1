package org.dicepool.dto.dice;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaceBidResponse {
    private boolean success;
    private long roundId;
    private long bidId;
    private String bettor;
    private long netStake;
    private long fee;
}
