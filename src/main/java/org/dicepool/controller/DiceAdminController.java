package org.dicepool.controller;

import lombok.RequiredArgsConstructor;
import org.dicepool.dto.dice.WithdrawRequest;
import org.dicepool.service.dice.engine.RoundManager;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

// Administration de la maison ; le contrôle d'autorité est fait par le moteur
@RestController
@RequestMapping("/api/dice/admin")
@RequiredArgsConstructor
public class DiceAdminController {

    private final RoundManager rounds;

    @PutMapping("/fee")
    public ResponseEntity<?> setFee(@RequestBody Map<String, Integer> body, Authentication authentication) {
        Integer percent = body.get("feePercent");
        if (percent == null) return ResponseEntity.badRequest().body(Map.of("code", "INVALID_ARGUMENT", "error", "feePercent requis"));
        rounds.setFeePercent(authentication.getName(), percent);
        return ResponseEntity.ok(Map.of("feePercent", percent));
    }

    @PostMapping("/authority")
    public ResponseEntity<?> transferAuthority(@RequestBody Map<String, String> body, Authentication authentication) {
        String email = body.get("email");
        rounds.transferAuthority(authentication.getName(), email);
        return ResponseEntity.ok(Map.of("authority", email));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<?> withdraw(@RequestBody WithdrawRequest req, Authentication authentication) {
        long solde = rounds.withdraw(authentication.getName(), req.receiver, req.montant);
        return ResponseEntity.ok(Map.of("receiver", req.receiver, "montant", req.montant, "solde", solde));
    }
}
