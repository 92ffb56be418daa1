package org.dicepool.model.dice;

public enum BetSide {
    BIG_NUMBER,
    SMALL_NUMBER;

    public boolean wins(RoundResult result) {
        return switch (this) {
            case BIG_NUMBER -> result == RoundResult.BIG_NUMBER;
            case SMALL_NUMBER -> result == RoundResult.SMALL_NUMBER;
        };
    }
}
