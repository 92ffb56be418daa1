package org.dicepool.controller;

import lombok.extern.slf4j.Slf4j;
import org.dicepool.service.dice.error.DiceEngineException;
import org.dicepool.service.dice.error.PaymentFailedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class DiceExceptionHandler {

    @ExceptionHandler(DiceEngineException.class)
    public ResponseEntity<DiceErrorResponse> handle(DiceEngineException ex) {
        if (ex instanceof PaymentFailedException) log.warn("Paiement échoué, opération annulée : {}", ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(new DiceErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<DiceErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new DiceErrorResponse("INVALID_ARGUMENT", ex.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<DiceErrorResponse> handleUnreadable(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new DiceErrorResponse("INVALID_REQUEST", "Requête invalide"));
    }

    public record DiceErrorResponse(String code, String error) {
    }
}
