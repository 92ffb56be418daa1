package org.dicepool.controller;

import jakarta.validation.Valid;
import org.dicepool.dto.AuthRequest;
import org.dicepool.dto.AuthResponse;
import org.dicepool.dto.RegisterRequest;
import org.dicepool.model.Utilisateur;
import org.dicepool.security.JwtUtil;
import org.dicepool.service.UtilisateurService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    @Autowired
    private UtilisateurService utilisateurService;

    @Autowired
    private JwtUtil jwtUtil;

    // --- Inscription : compte + wallet initial ---
    @PostMapping("/register")
    public ResponseEntity<?> inscrire(@Valid @RequestBody RegisterRequest req) {
        if (utilisateurService.trouverParEmail(req.getEmail()) != null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Email déjà utilisé"));
        }
        Utilisateur u = utilisateurService.inscrire(req.getEmail(), req.getPseudo(), req.getMotDePasse());
        String token = jwtUtil.genererToken(u.getEmail());
        return ResponseEntity.ok(new AuthResponse(token, u.getEmail(), u.getPseudo(), u.getRole()));
    }

    // --- Login classique ---
    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody AuthRequest req){
        Utilisateur u = utilisateurService.trouverParEmail(req.getEmail());
        if(u==null || !utilisateurService.verifierMotDePasse(u, req.getMotDePasse())){
            return ResponseEntity.status(401).body("Identifiants invalides");
        }
        String token = jwtUtil.genererToken(u.getEmail());
        return ResponseEntity.ok(new AuthResponse(token, u.getEmail(), u.getPseudo(), u.getRole()));
    }
}
