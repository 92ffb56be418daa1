package org.dicepool.model.dice;

public enum RoundState {
    WAITING_FOR_BIDS,
    PROCESSING,
    EQUALIZING,
    EQUALIZED,
    PAYING_WINNERS,
    FINISHED
}
