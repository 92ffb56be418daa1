package org.dicepool.model.dice;

public enum RoundResult {
    UNDETERMINED,
    BIG_NUMBER,
    SMALL_NUMBER;

    /** 3..10 = petit, 11..18 = grand. */
    public static RoundResult ofTotalPips(int totalPips) {
        return (totalPips >= 3 && totalPips <= 10) ? SMALL_NUMBER : BIG_NUMBER;
    }
}
