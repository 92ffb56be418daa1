package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class BelowMinimumStakeException extends DiceEngineException {
    public BelowMinimumStakeException(long amount, long minStake) {
        super("BELOW_MINIMUM_STAKE", HttpStatus.BAD_REQUEST,
                "Mise " + amount + " insuffisante : elle doit dépasser " + minStake);
    }
}
