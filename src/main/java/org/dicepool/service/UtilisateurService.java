package org.dicepool.service;

import org.dicepool.model.Utilisateur;
import org.dicepool.model.Wallet;
import org.dicepool.repo.UtilisateurRepository;
import org.dicepool.repo.WalletRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Service
public class UtilisateurService {
    @Autowired
    private UtilisateurRepository utilisateurRepo;
    @Autowired
    private WalletRepository walletRepo;
    @Autowired
    private PasswordEncoder passwordEncoder;

    @Value("${app.wallet.initial-credits:1000}")
    private long creditsInitiaux;

    @Transactional
    public Utilisateur inscrire(String email, String pseudo, String motDePassePlain) {
        if (email == null || email.isBlank()) throw new IllegalArgumentException("Email requis");
        if (motDePassePlain == null || motDePassePlain.isBlank()) throw new IllegalArgumentException("Mot de passe requis");
        if (utilisateurRepo.existsByEmail(email)) throw new IllegalArgumentException("Email déjà utilisé");

        Utilisateur u = Utilisateur.builder()
                .email(email)
                .pseudo(pseudo != null && !pseudo.isBlank() ? pseudo : email)
                .motDePasseHash(passwordEncoder.encode(motDePassePlain))
                .dateCreation(LocalDateTime.now())
                .active(true)
                .role("USER")
                .build();

        Utilisateur saved = utilisateurRepo.save(u);

        // wallet initial crédité, c'est avec lui que l'utilisateur mise
        walletRepo.save(Wallet.builder()
                .utilisateur(saved)
                .solde(creditsInitiaux)
                .build());

        return saved;
    }

    public Utilisateur trouverParEmail(String email){
        return utilisateurRepo.findByEmail(email).orElse(null);
    }

    public boolean verifierMotDePasse(Utilisateur utilisateur, String motDePassePlain) {
        return passwordEncoder.matches(motDePassePlain, utilisateur.getMotDePasseHash());
    }
}
