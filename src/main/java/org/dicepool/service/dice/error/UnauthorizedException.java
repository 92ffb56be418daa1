package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends DiceEngineException {
    public UnauthorizedException(String caller) {
        super("UNAUTHORIZED", HttpStatus.FORBIDDEN, "Réservé à l'autorité (appelant : " + caller + ")");
    }
}
