package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class InsufficientBalanceException extends DiceEngineException {
    public InsufficientBalanceException(long amount, long solde) {
        super("INSUFFICIENT_BALANCE", HttpStatus.CONFLICT,
                "Solde de la maison insuffisant (" + solde + ") pour " + amount);
    }
}
