package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class RoundAlreadyActiveException extends DiceEngineException {
    public RoundAlreadyActiveException(long activeRoundId) {
        super("ROUND_ALREADY_ACTIVE", HttpStatus.CONFLICT, "La manche " + activeRoundId + " est encore active");
    }
}
