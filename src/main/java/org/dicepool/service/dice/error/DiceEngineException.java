package org.dicepool.service.dice.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Violation de précondition d'une opération du moteur. Toujours remontée à l'appelant,
 * jamais rejouée ; lancée dans une transaction, elle l'annule entièrement.
 */
@Getter
public abstract class DiceEngineException extends RuntimeException {
    private final String code;
    private final HttpStatus status;

    protected DiceEngineException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected DiceEngineException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
