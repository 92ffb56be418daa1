package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class RoundNotFoundException extends DiceEngineException {
    public RoundNotFoundException(String message) {
        super("ROUND_NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }

    public static RoundNotFoundException byId(long roundId) {
        return new RoundNotFoundException("Manche inconnue : " + roundId);
    }
}
