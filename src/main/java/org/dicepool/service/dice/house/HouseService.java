package org.dicepool.service.dice.house;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dicepool.config.DiceProperties;
import org.dicepool.model.dice.DiceHouse;
import org.dicepool.repo.DiceHouseRepository;
import org.dicepool.service.dice.error.InsufficientBalanceException;
import org.dicepool.service.dice.error.PaymentFailedException;
import org.springframework.stereotype.Service;

/**
 * Registre de la maison : solde retenu, frais, compteur de manches et manche active.
 * Les méthodes d'écriture s'exécutent dans la transaction du {@code RoundManager}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HouseService {
    private final DiceHouseRepository repo;
    private final DiceProperties props;

    @PostConstruct
    public void initFromDb() {
        if (repo.existsById(DiceHouse.SINGLETON_ID)) return;
        DiceHouse house = new DiceHouse(props.getAuthorityEmail(), props.getFeePercent());
        repo.save(house);
        log.info("Registre de la maison initialisé (autorité={}, frais={}%)",
                house.getAuthorityEmail(), house.getFeePercent());
    }

    public DiceHouse get() {
        return repo.findById(DiceHouse.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Registre de la maison absent"));
    }

    public long solde() { return get().getSolde(); }

    public int feePercent() { return get().getFeePercent(); }

    public String authorityEmail() { return get().getAuthorityEmail(); }

    public long roundCount() { return get().getRoundCounter(); }

    public Long activeRoundId() { return get().getActiveRoundId(); }

    // ---- écritures ----

    public long nextRoundId() {
        DiceHouse h = get();
        h.setRoundCounter(h.getRoundCounter() + 1);
        return h.getRoundCounter();
    }

    public void markActive(long roundId) { get().setActiveRoundId(roundId); }

    public void clearActive() { get().setActiveRoundId(null); }

    public void crediter(long montant) {
        DiceHouse h = get();
        h.setSolde(h.getSolde() + montant);
    }

    /** Remboursement d'égalisation : la caisse doit couvrir le montant. */
    public void debiterRemboursement(long montant) {
        DiceHouse h = get();
        if (h.getSolde() < montant) throw new InsufficientBalanceException(montant, h.getSolde());
        h.setSolde(h.getSolde() - montant);
    }

    /** Retrait de l'autorité : le solde doit dépasser strictement le montant. */
    public void debiterRetrait(long montant) {
        DiceHouse h = get();
        if (h.getSolde() <= montant) throw new InsufficientBalanceException(montant, h.getSolde());
        h.setSolde(h.getSolde() - montant);
    }

    /** Gains : le solde doit couvrir le paiement, sinon le paiement échoue. */
    public void debiterPourPaiement(long montant) {
        DiceHouse h = get();
        if (h.getSolde() < montant) {
            throw new PaymentFailedException("Solde de la maison insuffisant (" + h.getSolde() + ") pour payer " + montant);
        }
        h.setSolde(h.getSolde() - montant);
    }

    public void setFeePercent(int percent) { get().setFeePercent(percent); }

    public void setAuthorityEmail(String email) { get().setAuthorityEmail(email); }
}
