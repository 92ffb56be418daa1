package org.dicepool.dto.dice;

import lombok.Builder;
import lombok.Data;
import org.dicepool.model.dice.BetSide;
import org.dicepool.model.dice.DiceBid;
import org.dicepool.model.dice.RoundState;

@Data
@Builder
public class BidDetail {
    private long roundId;
    private long bidId;
    private String bettor;
    private BetSide side;
    private long stake;
    private boolean won;
    private boolean finished; // la manche est terminée

    public static BidDetail from(DiceBid b) {
        return BidDetail.builder()
                .roundId(b.getRound().getId())
                .bidId(b.getBidId())
                .bettor(b.getBettorEmail())
                .side(b.getSide())
                .stake(b.getStake())
                .won(b.isWon())
                .finished(b.getRound().getState() == RoundState.FINISHED)
                .build();
    }
}
