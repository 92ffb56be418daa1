package org.dicepool.controller;

import org.dicepool.model.Utilisateur;
import org.dicepool.model.Wallet;
import org.dicepool.repo.UtilisateurRepository;
import org.dicepool.service.WalletService;
import org.dicepool.service.WalletSseService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

@RestController
@RequestMapping("/api/wallet")
public class WalletController {

    @Autowired
    private WalletService walletService;

    @Autowired
    private UtilisateurRepository utilisateurRepo;

    @Autowired
    private WalletSseService walletSseService;

    // Solde du parieur connecté ; les mouvements passent uniquement par le moteur de dés
    @GetMapping("/me")
    public ResponseEntity<?> solde(Authentication authentication){
        Utilisateur u = utilisateurRepo.findByEmail(authentication.getName()).orElseThrow();
        Wallet w = walletService.getWalletParUtilisateur(u);
        return ResponseEntity.ok(Map.of("email", u.getEmail(), "solde", w.getSolde()));
    }

    // Flux SSE des mises à jour de solde (gains, remboursements)
    @GetMapping("/stream")
    public SseEmitter stream(Authentication authentication) {
        if (authentication == null) throw new ResponseStatusException(HttpStatus.UNAUTHORIZED);
        return walletSseService.register(authentication.getName());
    }
}
