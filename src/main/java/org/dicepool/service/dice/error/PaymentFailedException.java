package org.dicepool.service.dice.error;

import org.springframework.http.HttpStatus;

public class PaymentFailedException extends DiceEngineException {
    public PaymentFailedException(String message) {
        super("PAYMENT_FAILED", HttpStatus.PAYMENT_REQUIRED, message);
    }

    public PaymentFailedException(String message, Throwable cause) {
        super("PAYMENT_FAILED", HttpStatus.PAYMENT_REQUIRED, message, cause);
    }
}
