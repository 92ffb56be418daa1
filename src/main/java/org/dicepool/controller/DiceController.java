package org.dicepool.controller;

import lombok.RequiredArgsConstructor;
import org.dicepool.dto.dice.*;
import org.dicepool.events.DiceEventBroadcaster;
import org.dicepool.service.dice.engine.RoundManager;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/dice")
@RequiredArgsConstructor
public class DiceController {

    private final RoundManager rounds;

    // --- réservé à l'autorité ---

    @PostMapping("/rounds")
    public ResponseEntity<RoundSummary> createRound(Authentication authentication) {
        return ResponseEntity.ok(rounds.createRound(authentication.getName()));
    }

    @PostMapping("/rounds/{id}/equalize")
    public ResponseEntity<RoundSummary> equalize(@PathVariable long id, Authentication authentication) {
        return ResponseEntity.ok(rounds.equalizeBids(authentication.getName(), id));
    }

    @PostMapping("/rounds/current/process")
    public ResponseEntity<RoundSummary> process(@RequestBody ProcessRoundRequest req, Authentication authentication) {
        if (req == null) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(rounds.processRound(authentication.getName(), req.dice1, req.dice2, req.dice3));
    }

    // --- ouvert à tout utilisateur connecté ---

    @PostMapping("/rounds/{id}/bids")
    public ResponseEntity<PlaceBidResponse> placeBid(@PathVariable long id,
                                                     @RequestBody PlaceBidRequest req,
                                                     Authentication authentication) {
        if (req == null) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(rounds.placeBid(authentication.getName(), id, req.side, req.montant));
    }

    @GetMapping("/rounds/current")
    public ResponseEntity<RoundSummary> current() {
        return ResponseEntity.ok(rounds.currentRound());
    }

    @GetMapping("/rounds/count")
    public ResponseEntity<?> count() {
        return ResponseEntity.ok(Map.of("count", rounds.roundCount()));
    }

    @GetMapping("/rounds/{id}")
    public ResponseEntity<RoundSummary> round(@PathVariable long id) {
        return ResponseEntity.ok(rounds.round(id));
    }

    @GetMapping("/rounds/{id}/bids/{bidId}")
    public ResponseEntity<BidDetail> bid(@PathVariable long id, @PathVariable long bidId) {
        return ResponseEntity.ok(rounds.bid(id, bidId));
    }

    @GetMapping("/balance")
    public ResponseEntity<?> balance() {
        return ResponseEntity.ok(Map.of("solde", rounds.balance()));
    }

    @GetMapping("/events")
    public ResponseEntity<List<DiceEventMessage>> events(@RequestParam(required = false) Long roundId) {
        return ResponseEntity.ok(rounds.events(roundId).stream()
                .map(DiceEventBroadcaster::toMessage)
                .toList());
    }
}
