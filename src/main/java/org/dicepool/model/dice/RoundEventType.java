package org.dicepool.model.dice;

public enum RoundEventType {
    ROUND_CREATED,
    BID_PLACED,
    EQUALIZE_REFUND,
    ROUND_EQUALIZED,
    WINNER_PAID,
    ROUND_PROCESSED,
    FEE_PERCENT_CHANGED,
    AUTHORITY_TRANSFERRED,
    WITHDRAWAL
}
