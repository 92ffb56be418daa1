package org.dicepool.service;

/** Nouveau solde d'un wallet, poussé en SSE une fois la transaction validée. */
public record WalletBalanceChanged(String email, long solde) {
}
