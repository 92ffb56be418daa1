package org.dicepool.service;

import org.dicepool.model.Utilisateur;
import org.dicepool.model.Wallet;
import org.dicepool.repo.WalletRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WalletService {
    @Autowired
    private WalletRepository walletRepo;

    @Autowired
    private ApplicationEventPublisher publisher;

    public Wallet getWalletParUtilisateur(Utilisateur u){
        return walletRepo.findByUtilisateur(u).orElseGet(() -> {
            Wallet w = Wallet.builder()
                    .utilisateur(u)
                    .solde(0L)
                    .build();
            return walletRepo.save(w);
        });
    }

    // Rejoint la transaction du moteur quand elle existe : un rollback annule le crédit et sa notification
    @Transactional
    public Wallet crediter(Utilisateur u, long montant){
        if (montant < 0) throw new IllegalArgumentException("Montant invalide");
        Wallet w = verrouiller(u);
        w.setSolde(w.getSolde() + montant);
        publisher.publishEvent(new WalletBalanceChanged(u.getEmail(), w.getSolde()));
        return w;
    }

    @Transactional
    public Wallet debiter(Utilisateur u, long montant){
        if (montant < 0) throw new IllegalArgumentException("Montant invalide");
        Wallet w = verrouiller(u);
        if (w.getSolde() < montant) throw new IllegalArgumentException("Solde insuffisant");
        w.setSolde(w.getSolde() - montant);
        publisher.publishEvent(new WalletBalanceChanged(u.getEmail(), w.getSolde()));
        return w;
    }

    private Wallet verrouiller(Utilisateur u) {
        return walletRepo.findForUpdate(u).orElseGet(() -> walletRepo.save(Wallet.builder()
                .utilisateur(u)
                .solde(0L)
                .build()));
    }
}
