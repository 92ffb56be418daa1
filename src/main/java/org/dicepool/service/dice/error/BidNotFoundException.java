package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class BidNotFoundException extends DiceEngineException {
    public BidNotFoundException(long roundId, long bidId) {
        super("BID_NOT_FOUND", HttpStatus.NOT_FOUND, "Mise " + bidId + " inconnue dans la manche " + roundId);
    }
}
