package org.dicepool.service.dice.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dicepool.model.Utilisateur;
import org.dicepool.repo.UtilisateurRepository;
import org.dicepool.service.WalletService;
import org.dicepool.service.dice.error.PaymentFailedException;
import org.springframework.stereotype.Component;

// Paiements entre la maison et les wallets des utilisateurs inscrits
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletPaymentGateway implements PaymentGateway {
    private final WalletService wallet;
    private final UtilisateurRepository users;

    @Override
    public void collect(String payerEmail, long montant) {
        Utilisateur u = find(payerEmail);
        try {
            wallet.debiter(u, montant);
        } catch (IllegalArgumentException ex) {
            log.warn("Encaissement refusé pour {} ({}) : {}", payerEmail, montant, ex.getMessage());
            throw new PaymentFailedException("Encaissement impossible pour " + payerEmail + " : " + ex.getMessage(), ex);
        }
    }

    @Override
    public void pay(String receiverEmail, long montant) {
        wallet.crediter(find(receiverEmail), montant);
    }

    private Utilisateur find(String email) {
        return users.findByEmail(email)
                .orElseThrow(() -> new PaymentFailedException("Compte inconnu : " + email));
    }
}
