package org.dicepool.dto.dice;

import org.dicepool.model.dice.BetSide;

public class PlaceBidRequest {
    public BetSide side; // BIG_NUMBER | SMALL_NUMBER
    public long montant;

    public PlaceBidRequest() {}
    public PlaceBidRequest(BetSide side, long montant) {
        this.side = side;
        this.montant = montant;
    }
}
