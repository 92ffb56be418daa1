package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class InvalidDiceValueException extends DiceEngineException {
    public InvalidDiceValueException(int value) {
        super("INVALID_DICE_VALUE", HttpStatus.BAD_REQUEST, "Valeur de dé hors de [1,6] : " + value);
    }
}
