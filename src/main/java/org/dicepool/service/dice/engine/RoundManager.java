package org.dicepool.service.dice.engine;

import lombok.extern.slf4j.Slf4j;
import org.dicepool.config.DiceProperties;
import org.dicepool.dto.dice.BidDetail;
import org.dicepool.dto.dice.PlaceBidResponse;
import org.dicepool.dto.dice.RoundSummary;
import org.dicepool.model.dice.*;
import org.dicepool.repo.DiceBidRepository;
import org.dicepool.repo.DiceRoundRepository;
import org.dicepool.repo.UtilisateurRepository;
import org.dicepool.service.dice.access.AuthorityPolicy;
import org.dicepool.service.dice.engine.SettlementEngine.EqualizationOutcome;
import org.dicepool.service.dice.engine.SettlementEngine.Payout;
import org.dicepool.service.dice.engine.SettlementEngine.Refund;
import org.dicepool.service.dice.error.*;
import org.dicepool.service.dice.events.DiceEngineEvent;
import org.dicepool.service.dice.events.RoundEventRecorder;
import org.dicepool.service.dice.house.HouseService;
import org.dicepool.service.dice.payment.PaymentGateway;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Cycle de vie de la manche courante :
 * WAITING_FOR_BIDS → EQUALIZING → EQUALIZED → PROCESSING → PAYING_WINNERS → FINISHED,
 * puis ouverture automatique de la suivante.
 *
 * <p>Un seul écrivain à la fois (verrou d'écriture tenu jusqu'au commit) ; chaque opération
 * est une transaction, donc un paiement qui échoue annule aussi les paiements déjà faits.
 * Les lectures partagent le verrou de lecture et ne voient jamais une manche en transition.
 *
 * <p>Pas de {@code @Transactional} ici : le proxy commiterait après la sortie de la méthode,
 * donc après la libération du verrou. La transaction est ouverte à l'intérieur du verrou
 * par un {@link TransactionTemplate}, et le commit a lieu avant {@code unlock()}.
 */
@Slf4j
@Service
public class RoundManager {
    private final DiceRoundRepository rounds;
    private final DiceBidRepository bids;
    private final UtilisateurRepository users;
    private final HouseService house;
    private final SettlementEngine settlement;
    private final PaymentGateway payments;
    private final AuthorityPolicy authority;
    private final RoundEventRecorder events;
    private final DiceProperties props;

    private final TransactionTemplate tx;
    private final TransactionTemplate readTx;
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

    public RoundManager(DiceRoundRepository rounds, DiceBidRepository bids, UtilisateurRepository users,
                        HouseService house, SettlementEngine settlement, PaymentGateway payments,
                        AuthorityPolicy authority, RoundEventRecorder events, DiceProperties props,
                        PlatformTransactionManager txManager) {
        this.rounds = rounds;
        this.bids = bids;
        this.users = users;
        this.house = house;
        this.settlement = settlement;
        this.payments = payments;
        this.authority = authority;
        this.events = events;
        this.props = props;
        this.tx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void openFirstRoundIfConfigured() {
        if (!props.isCreateFirstRound()) return;
        write(() -> {
            if (house.roundCount() == 0) openRound();
            return null;
        });
    }

    // ------------------------------------------------------------------ cycle de vie

    public RoundSummary createRound(String caller) {
        return write(() -> {
            authority.ensureAuthority(caller);
            return RoundSummary.from(openRound());
        });
    }

    public PlaceBidResponse placeBid(String bettor, long roundId, BetSide side, long amount) {
        return write(() -> {
            DiceRound round = rounds.findWithBids(roundId).orElseThrow(() -> RoundNotFoundException.byId(roundId));
            requireState(round, RoundState.WAITING_FOR_BIDS);
            if (amount <= props.getMinStake()) throw new BelowMinimumStakeException(amount, props.getMinStake());
            if (side == null) throw new IllegalArgumentException("Côté de mise requis (BIG_NUMBER ou SMALL_NUMBER)");

            long fee = Math.multiplyExact(amount, (long) house.feePercent()) / 100;
            long netStake = amount - fee;

            // la mise entière entre dans la caisse ; les frais y restent
            payments.collect(bettor, amount);
            house.crediter(amount);
            DiceBid bid = round.addBid(bettor, side, netStake, Instant.now());

            events.record(RoundEventType.BID_PLACED, roundId, payload(
                    "bidId", bid.getBidId(),
                    "roundId", roundId,
                    "bettor", bettor,
                    "netStake", netStake,
                    "fee", fee,
                    "side", side.name()));
            log.debug("Mise #{} sur la manche {} : {} {} (net {}, frais {})",
                    bid.getBidId(), roundId, bettor, side, netStake, fee);
            return new PlaceBidResponse(true, roundId, bid.getBidId(), bettor, netStake, fee);
        });
    }

    public RoundSummary equalizeBids(String caller, long roundId) {
        return write(() -> {
            authority.ensureAuthority(caller);
            DiceRound round = rounds.findWithBids(roundId).orElseThrow(() -> RoundNotFoundException.byId(roundId));
            requireState(round, RoundState.WAITING_FOR_BIDS);
            round.setState(RoundState.EQUALIZING);

            if (round.getBigPoolTotal() == 0 && round.getSmallPoolTotal() == 0) {
                round.setState(RoundState.EQUALIZED);
                log.info("Manche {} sans mise, égalisée d'office", roundId);
                return RoundSummary.from(round);
            }

            EqualizationOutcome outcome = settlement.equalize(
                    round.getBigPoolTotal(), round.getSmallPoolTotal(), SettlementEngine.linesOf(round.getBids()));

            for (Refund refund : outcome.refunds()) {
                DiceBid bid = round.bid(refund.bidId());
                // remboursement dû mais caisse insuffisante : tout échoue plutôt que perdre le remboursement
                house.debiterRemboursement(refund.amount());
                bid.reduceStake(refund.amount());
                payments.pay(bid.getBettorEmail(), refund.amount());
                events.record(RoundEventType.EQUALIZE_REFUND, roundId, payload(
                        "roundId", roundId,
                        "bidId", bid.getBidId(),
                        "bettor", bid.getBettorEmail(),
                        "amount", refund.amount(),
                        "remainingStake", bid.getStake()));
                log.debug("Remboursement de {} sur la mise #{} ({})", refund.amount(), bid.getBidId(), bid.getBettorEmail());
            }

            round.setBigPoolTotal(outcome.bigPoolTotal());
            round.setSmallPoolTotal(outcome.smallPoolTotal());
            round.setState(RoundState.EQUALIZED);
            events.record(RoundEventType.ROUND_EQUALIZED, roundId, payload(
                    "roundId", roundId,
                    "state", round.getState().name(),
                    "bigPoolTotal", round.getBigPoolTotal(),
                    "smallPoolTotal", round.getSmallPoolTotal()));
            log.info("Manche {} égalisée : big={} small={} ({} remboursement(s))",
                    roundId, round.getBigPoolTotal(), round.getSmallPoolTotal(), outcome.refunds().size());
            return RoundSummary.from(round);
        });
    }

    public RoundSummary processRound(String caller, int dice1, int dice2, int dice3) {
        return write(() -> {
            authority.ensureAuthority(caller);
            requireDie(dice1);
            requireDie(dice2);
            requireDie(dice3);

            Long activeId = house.activeRoundId();
            if (activeId == null) throw new RoundNotFoundException("Aucune manche active");
            DiceRound round = rounds.findWithBids(activeId).orElseThrow(() -> RoundNotFoundException.byId(activeId));
            requireState(round, RoundState.EQUALIZED);

            round.setState(RoundState.PROCESSING);
            round.recordRoll(dice1, dice2, dice3);

            if (round.getBigPoolTotal() == 0 || round.getSmallPoolTotal() == 0) {
                log.info("Manche {} : aucun pool adverse, clôture sans paiement", round.getId());
                finish(round);
                return RoundSummary.from(round);
            }

            round.setState(RoundState.PAYING_WINNERS);
            List<Payout> payouts = settlement.computePayouts(round.getResult(), SettlementEngine.linesOf(round.getBids()));
            for (Payout p : payouts) {
                if (!p.winner()) continue;
                DiceBid bid = round.bid(p.bidId());
                bid.markWon();
                // mise entièrement remboursée à l'égalisation : gagnante, mais rien à verser
                if (p.amount() == 0) continue;

                house.debiterPourPaiement(p.amount());
                payments.pay(bid.getBettorEmail(), p.amount());
                events.record(RoundEventType.WINNER_PAID, round.getId(), payload(
                        "roundId", round.getId(),
                        "bidId", bid.getBidId(),
                        "bettor", bid.getBettorEmail(),
                        "amount", p.amount()));
                log.debug("Gain de {} versé à {} (mise #{})", p.amount(), bid.getBettorEmail(), bid.getBidId());
            }

            finish(round);
            return RoundSummary.from(round);
        });
    }

    // ------------------------------------------------------------------ administration

    public void setFeePercent(String caller, int percent) {
        write(() -> {
            authority.ensureAuthority(caller);
            if (percent < 0 || percent > 100) throw new IllegalArgumentException("Frais hors de [0,100] : " + percent);
            int previous = house.feePercent();
            house.setFeePercent(percent);
            events.record(RoundEventType.FEE_PERCENT_CHANGED, null, payload("previous", previous, "feePercent", percent));
            log.info("Frais passés de {}% à {}%", previous, percent);
            return null;
        });
    }

    public void transferAuthority(String caller, String newAuthority) {
        write(() -> {
            authority.ensureAuthority(caller);
            if (newAuthority == null || newAuthority.isBlank()) throw new IllegalArgumentException("Nouvelle autorité requise");
            if (!users.existsByEmail(newAuthority)) throw new IllegalArgumentException("Utilisateur inconnu : " + newAuthority);
            house.setAuthorityEmail(newAuthority);
            events.record(RoundEventType.AUTHORITY_TRANSFERRED, null, payload("previous", caller, "authority", newAuthority));
            log.info("Autorité transférée de {} à {}", caller, newAuthority);
            return null;
        });
    }

    public long withdraw(String caller, String receiver, long amount) {
        return write(() -> {
            authority.ensureAuthority(caller);
            if (amount <= 0) throw new IllegalArgumentException("Montant invalide : " + amount);
            if (receiver == null || receiver.isBlank()) throw new IllegalArgumentException("Bénéficiaire requis");
            house.debiterRetrait(amount);
            payments.pay(receiver, amount);
            events.record(RoundEventType.WITHDRAWAL, null, payload("receiver", receiver, "amount", amount));
            log.info("Retrait de {} vers {}", amount, receiver);
            return house.solde();
        });
    }

    // ------------------------------------------------------------------ lectures

    public RoundSummary currentRound() {
        return read(() -> {
            Long activeId = house.activeRoundId();
            if (activeId == null) throw new RoundNotFoundException("Aucune manche active");
            return RoundSummary.from(rounds.findWithBids(activeId).orElseThrow(() -> RoundNotFoundException.byId(activeId)));
        });
    }

    public RoundSummary round(long roundId) {
        return read(() -> RoundSummary.from(
                rounds.findWithBids(roundId).orElseThrow(() -> RoundNotFoundException.byId(roundId))));
    }

    public BidDetail bid(long roundId, long bidId) {
        return read(() -> {
            if (!rounds.existsById(roundId)) throw RoundNotFoundException.byId(roundId);
            return BidDetail.from(bids.findByRoundIdAndBidId(roundId, bidId)
                    .orElseThrow(() -> new BidNotFoundException(roundId, bidId)));
        });
    }

    public long roundCount() {
        return read(house::roundCount);
    }

    public long balance() {
        return read(house::solde);
    }

    public List<DiceEngineEvent> events(Long roundId) {
        return read(() -> events.history(roundId));
    }

    // ------------------------------------------------------------------ interne

    private DiceRound openRound() {
        Long active = house.activeRoundId();
        if (active != null) throw new RoundAlreadyActiveException(active);

        long id = house.nextRoundId();
        DiceRound round = rounds.save(new DiceRound(id, Instant.now()));
        house.markActive(id);
        events.record(RoundEventType.ROUND_CREATED, id, payload("roundId", id, "state", round.getState().name()));
        log.info("Manche {} ouverte", id);
        return round;
    }

    private void finish(DiceRound round) {
        round.setState(RoundState.FINISHED);
        round.setFinishedAt(Instant.now());
        events.record(RoundEventType.ROUND_PROCESSED, round.getId(), payload(
                "roundId", round.getId(),
                "state", round.getState().name(),
                "result", round.getResult().name(),
                "dice", round.getDice(),
                "totalPips", round.getTotalPips()));
        log.info("Manche {} terminée : {} ({} points)", round.getId(), round.getResult(), round.getTotalPips());
        house.clearActive();
        openRound();
    }

    private static void requireState(DiceRound round, RoundState expected) {
        if (round.getState() != expected) throw new InvalidRoundStateException(round.getId(), round.getState(), expected);
    }

    private static void requireDie(int value) {
        if (value < 1 || value > 6) throw new InvalidDiceValueException(value);
    }

    private static Map<String, Object> payload(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    private <T> T write(Supplier<T> op) {
        lock.writeLock().lock();
        try {
            return tx.execute(status -> op.get());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> op) {
        lock.readLock().lock();
        try {
            return readTx.execute(status -> op.get());
        } finally {
            lock.readLock().unlock();
        }
    }
}
