package org.dicepool.service.dice.error;

import org.dicepool.model.dice.RoundState;
import org.springframework.http.HttpStatus;

public class InvalidRoundStateException extends DiceEngineException {
    public InvalidRoundStateException(long roundId, RoundState actual, RoundState expected) {
        super("INVALID_ROUND_STATE", HttpStatus.CONFLICT,
                "Manche " + roundId + " en " + actual + " (attendu : " + expected + ")");
    }
}
