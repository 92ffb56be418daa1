package org.dicepool.service.dice.payment;

/**
 * Primitive de paiement externe, bloquante et tout-ou-rien.
 * Toute erreur est une {@link org.dicepool.service.dice.error.PaymentFailedException}
 * qui annule l'opération appelante.
 */
public interface PaymentGateway {

    /** Encaisse {@code montant} depuis le compte du payeur. */
    void collect(String payerEmail, long montant);

    /** Verse {@code montant} sur le compte du bénéficiaire. */
    void pay(String receiverEmail, long montant);
}
