package org.dicepool.dto.dice;

import lombok.Builder;
import lombok.Data;
import org.dicepool.model.dice.DiceBid;
import org.dicepool.model.dice.DiceRound;
import org.dicepool.model.dice.RoundResult;
import org.dicepool.model.dice.RoundState;

import java.util.List;

@Data
@Builder
public class RoundSummary {
    private long id;
    private RoundState state;
    private RoundResult result;
    private List<Integer> dice;
    private int totalPips;
    private long bigPoolTotal;
    private long smallPoolTotal;
    private List<Long> bidIds; // ordre de placement
    private String createdAt;
    private String finishedAt;

    public static RoundSummary from(DiceRound r) {
        return RoundSummary.builder()
                .id(r.getId())
                .state(r.getState())
                .result(r.getResult())
                .dice(r.getDice())
                .totalPips(r.getTotalPips())
                .bigPoolTotal(r.getBigPoolTotal())
                .smallPoolTotal(r.getSmallPoolTotal())
                .bidIds(r.getBids().stream().map(DiceBid::getBidId).toList())
                .createdAt(r.getCreatedAt().toString())
                .finishedAt(r.getFinishedAt() != null ? r.getFinishedAt().toString() : null)
                .build();
    }
}
