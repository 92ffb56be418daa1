package org.dicepool.dto.dice;

public class WithdrawRequest {
    public String receiver;
    public long montant;

    public WithdrawRequest() {}
    public WithdrawRequest(String receiver, long montant) {
        this.receiver = receiver;
        this.montant = montant;
    }
}
