package org.dicepool.service.dice.engine;

import org.dicepool.DiceIntegrationSupport;
import org.dicepool.dto.dice.BidDetail;
import org.dicepool.dto.dice.PlaceBidResponse;
import org.dicepool.dto.dice.RoundSummary;
import org.dicepool.model.dice.RoundEventType;
import org.dicepool.model.dice.RoundResult;
import org.dicepool.model.dice.RoundState;
import org.dicepool.service.dice.error.*;
import org.dicepool.service.dice.events.DiceEngineEvent;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;
import static org.dicepool.model.dice.BetSide.BIG_NUMBER;
import static org.dicepool.model.dice.BetSide.SMALL_NUMBER;

@SpringBootTest
@TestPropertySource(properties = "spring.datasource.url=jdbc:h2:mem:roundmanager;DB_CLOSE_DELAY=-1;MODE=PostgreSQL")
class RoundManagerIntegrationTest extends DiceIntegrationSupport {

    private List<RoundEventType> typesOf(long roundId) {
        return manager.events(roundId).stream().map(DiceEngineEvent::type).toList();
    }

    private List<DiceEngineEvent> eventsOf(long roundId, RoundEventType type) {
        return manager.events(roundId).stream().filter(e -> e.type() == type).toList();
    }

    private static long asLong(Object v) {
        return ((Number) v).longValue();
    }

    // --------------------------------------------------------------
    // création et cycle de vie
    // --------------------------------------------------------------

    @Test
    void createRound_idsSequentiels_etUneSeuleMancheActive() {
        RoundSummary r1 = manager.createRound(ADMIN);

        assertThat(r1.getId()).isEqualTo(1L);
        assertThat(r1.getState()).isEqualTo(RoundState.WAITING_FOR_BIDS);
        assertThat(r1.getResult()).isEqualTo(RoundResult.UNDETERMINED);
        assertThat(manager.roundCount()).isEqualTo(1L);

        assertThatThrownBy(() -> manager.createRound(ADMIN)).isInstanceOf(RoundAlreadyActiveException.class);
        assertThat(manager.roundCount()).isEqualTo(1L);

        manager.equalizeBids(ADMIN, 1L);
        manager.processRound(ADMIN, 1, 2, 3);

        assertThat(manager.round(1L).getState()).isEqualTo(RoundState.FINISHED);
        assertThat(manager.currentRound().getId()).isEqualTo(2L);
        assertThat(manager.currentRound().getState()).isEqualTo(RoundState.WAITING_FOR_BIDS);

        manager.equalizeBids(ADMIN, 2L);
        manager.processRound(ADMIN, 6, 6, 6);

        assertThat(manager.currentRound().getId()).isEqualTo(3L);
        assertThat(manager.roundCount()).isEqualTo(3L);
    }

    @Test
    void createRound_refuseHorsAutorite() {
        assertThatThrownBy(() -> manager.createRound(ALICE)).isInstanceOf(UnauthorizedException.class);
        assertThat(manager.roundCount()).isZero();
        assertThatThrownBy(() -> manager.currentRound()).isInstanceOf(RoundNotFoundException.class);
    }

    @Test
    void equalize_mancheSansMise_passeDirectementAEgalisee() {
        manager.createRound(ADMIN);

        RoundSummary r = manager.equalizeBids(ADMIN, 1L);

        assertThat(r.getState()).isEqualTo(RoundState.EQUALIZED);
        assertThat(typesOf(1L)).containsExactly(RoundEventType.ROUND_CREATED);
    }

    // --------------------------------------------------------------
    // mises
    // --------------------------------------------------------------

    @Test
    void placeBid_preleveLesFraisEtDebiteLeWallet() {
        manager.createRound(ADMIN);

        PlaceBidResponse a = manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        PlaceBidResponse b = manager.placeBid(BOB, 1L, SMALL_NUMBER, 51);

        assertThat(a.isSuccess()).isTrue();
        assertThat(a.getBidId()).isEqualTo(1L);
        assertThat(a.getNetStake()).isEqualTo(98);
        assertThat(a.getFee()).isEqualTo(2);
        // 51 * 2 / 100 = 1 (troncature)
        assertThat(b.getBidId()).isEqualTo(2L);
        assertThat(b.getFee()).isEqualTo(1);
        assertThat(b.getNetStake()).isEqualTo(50);

        assertThat(soldeWallet(ALICE)).isEqualTo(900);
        assertThat(soldeWallet(BOB)).isEqualTo(949);
        assertThat(manager.balance()).isEqualTo(151);

        RoundSummary r = manager.round(1L);
        assertThat(r.getBigPoolTotal()).isEqualTo(98);
        assertThat(r.getSmallPoolTotal()).isEqualTo(50);
        assertThat(r.getBidIds()).containsExactly(1L, 2L);

        DiceEngineEvent placed = eventsOf(1L, RoundEventType.BID_PLACED).get(0);
        assertThat(placed.payload().get("bettor")).isEqualTo(ALICE);
        assertThat(asLong(placed.payload().get("netStake"))).isEqualTo(98);
        assertThat(asLong(placed.payload().get("fee"))).isEqualTo(2);
        assertThat(placed.payload().get("side")).isEqualTo("BIG_NUMBER");
    }

    @Test
    void placeBid_laMiseDoitDepasserStrictementLeMinimum() {
        manager.createRound(ADMIN);

        assertThatThrownBy(() -> manager.placeBid(ALICE, 1L, BIG_NUMBER, 10))
                .isInstanceOf(BelowMinimumStakeException.class);
        assertThat(manager.round(1L).getBidIds()).isEmpty();
        assertThat(soldeWallet(ALICE)).isEqualTo(1000);

        PlaceBidResponse ok = manager.placeBid(ALICE, 1L, BIG_NUMBER, 11);
        assertThat(ok.getBidId()).isEqualTo(1L);
        assertThat(ok.getFee()).isZero();
        assertThat(ok.getNetStake()).isEqualTo(11);
    }

    @Test
    void placeBid_mancheInconnue() {
        manager.createRound(ADMIN);

        assertThatThrownBy(() -> manager.placeBid(ALICE, 42L, BIG_NUMBER, 100))
                .isInstanceOf(RoundNotFoundException.class);
        assertThat(soldeWallet(ALICE)).isEqualTo(1000);
    }

    @Test
    void placeBid_horsPhaseDeMise_laMancheResteInchangee() {
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.placeBid(BOB, 1L, SMALL_NUMBER, 100);
        manager.equalizeBids(ADMIN, 1L);
        RoundSummary avant = manager.round(1L);

        assertThatThrownBy(() -> manager.placeBid(CAROL, 1L, SMALL_NUMBER, 100))
                .isInstanceOf(InvalidRoundStateException.class);

        assertThat(manager.round(1L)).isEqualTo(avant);
        assertThat(soldeWallet(CAROL)).isEqualTo(1000);
    }

    @Test
    void placeBid_fondsInsuffisants_rienNestEnregistre() {
        manager.createRound(ADMIN);

        assertThatThrownBy(() -> manager.placeBid(ALICE, 1L, BIG_NUMBER, 5000))
                .isInstanceOf(PaymentFailedException.class);

        assertThat(manager.round(1L).getBidIds()).isEmpty();
        assertThat(manager.balance()).isZero();
        assertThat(soldeWallet(ALICE)).isEqualTo(1000);
        assertThat(typesOf(1L)).containsExactly(RoundEventType.ROUND_CREATED);

        // le numéro n'a pas été consommé
        assertThat(manager.placeBid(ALICE, 1L, BIG_NUMBER, 100).getBidId()).isEqualTo(1L);
    }

    // --------------------------------------------------------------
    // égalisation et paiement
    // --------------------------------------------------------------

    @Test
    void cycleComplet_egalisationEnOrdreInverse_puisPaiementDuGagnant() {
        manager.setFeePercent(ADMIN, 0);
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.placeBid(BOB, 1L, BIG_NUMBER, 100);
        manager.placeBid(CAROL, 1L, BIG_NUMBER, 100);
        manager.placeBid(DAVE, 1L, SMALL_NUMBER, 100);

        RoundSummary eq = manager.equalizeBids(ADMIN, 1L);

        assertThat(eq.getState()).isEqualTo(RoundState.EQUALIZED);
        assertThat(eq.getBigPoolTotal()).isEqualTo(100);
        assertThat(eq.getSmallPoolTotal()).isEqualTo(100);
        assertThat(manager.bid(1L, 1L).getStake()).isEqualTo(100);
        assertThat(manager.bid(1L, 2L).getStake()).isZero();
        assertThat(manager.bid(1L, 3L).getStake()).isZero();
        long totalMises = LongStream.rangeClosed(1, 4).map(id -> manager.bid(1L, id).getStake()).sum();
        assertThat(totalMises).isEqualTo(eq.getBigPoolTotal() + eq.getSmallPoolTotal());
        assertThat(eventsOf(1L, RoundEventType.EQUALIZE_REFUND))
                .extracting(e -> asLong(e.payload().get("bidId")))
                .containsExactly(3L, 2L);
        assertThat(soldeWallet(BOB)).isEqualTo(1000);
        assertThat(soldeWallet(CAROL)).isEqualTo(1000);
        assertThat(manager.balance()).isEqualTo(200);

        RoundSummary done = manager.processRound(ADMIN, 6, 5, 4);

        assertThat(done.getState()).isEqualTo(RoundState.FINISHED);
        assertThat(done.getResult()).isEqualTo(RoundResult.BIG_NUMBER);
        assertThat(done.getTotalPips()).isEqualTo(15);
        assertThat(done.getDice()).containsExactly(6, 5, 4);

        assertThat(soldeWallet(ALICE)).isEqualTo(1100);
        assertThat(soldeWallet(DAVE)).isEqualTo(900);
        assertThat(manager.balance()).isZero();

        BidDetail alice = manager.bid(1L, 1L);
        assertThat(alice.isWon()).isTrue();
        assertThat(alice.isFinished()).isTrue();
        // remboursée entièrement : gagnante mais rien versé
        assertThat(manager.bid(1L, 2L).isWon()).isTrue();
        assertThat(manager.bid(1L, 4L).isWon()).isFalse();

        List<DiceEngineEvent> paid = eventsOf(1L, RoundEventType.WINNER_PAID);
        assertThat(paid).hasSize(1);
        assertThat(paid.get(0).payload().get("bettor")).isEqualTo(ALICE);
        assertThat(asLong(paid.get(0).payload().get("amount"))).isEqualTo(200);

        assertThat(manager.currentRound().getId()).isEqualTo(2L);
    }

    @Test
    void equalize_refuseHorsAutoriteEtHorsPhaseDeMise() {
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);

        assertThatThrownBy(() -> manager.equalizeBids(ALICE, 1L)).isInstanceOf(UnauthorizedException.class);
        assertThat(manager.round(1L).getState()).isEqualTo(RoundState.WAITING_FOR_BIDS);

        manager.equalizeBids(ADMIN, 1L);
        assertThatThrownBy(() -> manager.equalizeBids(ADMIN, 1L)).isInstanceOf(InvalidRoundStateException.class);
        assertThatThrownBy(() -> manager.equalizeBids(ADMIN, 9L)).isInstanceOf(RoundNotFoundException.class);
    }

    @Test
    void equalize_caisseInsuffisante_toutEstAnnule() {
        manager.setFeePercent(ADMIN, 0);
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.placeBid(BOB, 1L, BIG_NUMBER, 50);
        manager.withdraw(ADMIN, ADMIN, 149);

        assertThatThrownBy(() -> manager.equalizeBids(ADMIN, 1L)).isInstanceOf(InsufficientBalanceException.class);

        RoundSummary r = manager.round(1L);
        assertThat(r.getState()).isEqualTo(RoundState.WAITING_FOR_BIDS);
        assertThat(r.getBigPoolTotal()).isEqualTo(150);
        assertThat(manager.bid(1L, 2L).getStake()).isEqualTo(50);
        assertThat(soldeWallet(BOB)).isEqualTo(950);
        assertThat(manager.balance()).isEqualTo(1);
        assertThat(eventsOf(1L, RoundEventType.EQUALIZE_REFUND)).isEmpty();
    }

    @Test
    void process_unPoolVide_clotureSansPaiement() {
        manager.setFeePercent(ADMIN, 0);
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.equalizeBids(ADMIN, 1L);

        // tout a été rendu, la caisse est vide
        assertThat(soldeWallet(ALICE)).isEqualTo(1000);
        assertThat(manager.balance()).isZero();

        RoundSummary done = manager.processRound(ADMIN, 1, 1, 1);

        assertThat(done.getState()).isEqualTo(RoundState.FINISHED);
        assertThat(done.getResult()).isEqualTo(RoundResult.SMALL_NUMBER);
        assertThat(done.getTotalPips()).isEqualTo(3);
        assertThat(eventsOf(1L, RoundEventType.WINNER_PAID)).isEmpty();
        assertThat(manager.currentRound().getId()).isEqualTo(2L);
        assertThat(manager.currentRound().getState()).isEqualTo(RoundState.WAITING_FOR_BIDS);
    }

    @Test
    void process_totalDix_estPetit() {
        manager.setFeePercent(ADMIN, 0);
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 50);
        manager.placeBid(BOB, 1L, SMALL_NUMBER, 50);
        manager.equalizeBids(ADMIN, 1L);

        RoundSummary done = manager.processRound(ADMIN, 4, 3, 3);

        assertThat(done.getResult()).isEqualTo(RoundResult.SMALL_NUMBER);
        assertThat(soldeWallet(BOB)).isEqualTo(1050);
        assertThat(soldeWallet(ALICE)).isEqualTo(950);
    }

    @Test
    void process_totalOnze_estGrand() {
        manager.setFeePercent(ADMIN, 0);
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 50);
        manager.placeBid(BOB, 1L, SMALL_NUMBER, 50);
        manager.equalizeBids(ADMIN, 1L);

        RoundSummary done = manager.processRound(ADMIN, 5, 3, 3);

        assertThat(done.getResult()).isEqualTo(RoundResult.BIG_NUMBER);
        assertThat(soldeWallet(ALICE)).isEqualTo(1050);
    }

    @Test
    void process_gardesDEtatEtDeValeurs() {
        assertThatThrownBy(() -> manager.processRound(ADMIN, 1, 2, 3)).isInstanceOf(RoundNotFoundException.class);

        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);

        assertThatThrownBy(() -> manager.processRound(ADMIN, 1, 2, 3)).isInstanceOf(InvalidRoundStateException.class);
        assertThatThrownBy(() -> manager.processRound(ADMIN, 0, 3, 3)).isInstanceOf(InvalidDiceValueException.class);
        assertThatThrownBy(() -> manager.processRound(ADMIN, 1, 7, 1)).isInstanceOf(InvalidDiceValueException.class);
        assertThatThrownBy(() -> manager.processRound(ALICE, 1, 2, 3)).isInstanceOf(UnauthorizedException.class);

        RoundSummary r = manager.round(1L);
        assertThat(r.getState()).isEqualTo(RoundState.WAITING_FOR_BIDS);
        assertThat(r.getResult()).isEqualTo(RoundResult.UNDETERMINED);
        assertThat(r.getTotalPips()).isZero();
    }

    @Test
    void process_caisseInsuffisantePourLesGains_echecDePaiementEtAnnulation() {
        manager.setFeePercent(ADMIN, 0);
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.placeBid(BOB, 1L, SMALL_NUMBER, 100);
        manager.equalizeBids(ADMIN, 1L);
        manager.withdraw(ADMIN, ADMIN, 150);

        assertThatThrownBy(() -> manager.processRound(ADMIN, 6, 6, 6)).isInstanceOf(PaymentFailedException.class);

        RoundSummary r = manager.round(1L);
        assertThat(r.getState()).isEqualTo(RoundState.EQUALIZED);
        assertThat(r.getResult()).isEqualTo(RoundResult.UNDETERMINED);
        assertThat(manager.bid(1L, 1L).isWon()).isFalse();
        assertThat(manager.balance()).isEqualTo(50);
        assertThat(manager.roundCount()).isEqualTo(1L);
    }

    // --------------------------------------------------------------
    // administration
    // --------------------------------------------------------------

    @Test
    void withdraw_leMontantDoitEtreStrictementInferieurAuSolde() {
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.placeBid(BOB, 1L, SMALL_NUMBER, 100);

        assertThatThrownBy(() -> manager.withdraw(ADMIN, CAROL, 200)).isInstanceOf(InsufficientBalanceException.class);
        assertThatThrownBy(() -> manager.withdraw(ALICE, ALICE, 10)).isInstanceOf(UnauthorizedException.class);
        assertThat(soldeWallet(CAROL)).isEqualTo(1000);

        long reste = manager.withdraw(ADMIN, CAROL, 199);

        assertThat(reste).isEqualTo(1);
        assertThat(manager.balance()).isEqualTo(1);
        assertThat(soldeWallet(CAROL)).isEqualTo(1199);
        assertThat(manager.events(null)).extracting(DiceEngineEvent::type).contains(RoundEventType.WITHDRAWAL);
    }

    @Test
    void setFeePercent_changeLesFraisDesMisesSuivantes() {
        assertThatThrownBy(() -> manager.setFeePercent(ALICE, 5)).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> manager.setFeePercent(ADMIN, 101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.setFeePercent(ADMIN, -1)).isInstanceOf(IllegalArgumentException.class);

        manager.setFeePercent(ADMIN, 10);
        manager.createRound(ADMIN);

        PlaceBidResponse r = manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        assertThat(r.getFee()).isEqualTo(10);
        assertThat(r.getNetStake()).isEqualTo(90);
    }

    @Test
    void transferAuthority_leNouveauTitulaireSeulPeutAdministrer() {
        assertThatThrownBy(() -> manager.transferAuthority(ADMIN, "inconnu@test.com"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.transferAuthority(BOB, BOB)).isInstanceOf(UnauthorizedException.class);

        manager.transferAuthority(ADMIN, BOB);

        assertThatThrownBy(() -> manager.createRound(ADMIN)).isInstanceOf(UnauthorizedException.class);
        assertThat(manager.createRound(BOB).getId()).isEqualTo(1L);
    }

    // --------------------------------------------------------------
    // journal et lectures
    // --------------------------------------------------------------

    @Test
    void journal_ordreDesEvenementsDUneManche() {
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, BIG_NUMBER, 100);
        manager.placeBid(BOB, 1L, SMALL_NUMBER, 100);
        manager.equalizeBids(ADMIN, 1L);
        manager.processRound(ADMIN, 6, 6, 6);

        assertThat(typesOf(1L)).containsExactly(
                RoundEventType.ROUND_CREATED,
                RoundEventType.BID_PLACED,
                RoundEventType.BID_PLACED,
                RoundEventType.ROUND_EQUALIZED,
                RoundEventType.WINNER_PAID,
                RoundEventType.ROUND_PROCESSED);
        assertThat(typesOf(2L)).containsExactly(RoundEventType.ROUND_CREATED);

        DiceEngineEvent processed = eventsOf(1L, RoundEventType.ROUND_PROCESSED).get(0);
        assertThat(processed.payload().get("result")).isEqualTo("BIG_NUMBER");
        assertThat(asLong(processed.payload().get("totalPips"))).isEqualTo(18);

        // 2 x 98 versés sur 200 encaissés : les frais restent à la maison
        assertThat(soldeWallet(ALICE)).isEqualTo(900 + 196);
        assertThat(manager.balance()).isEqualTo(4);
    }

    @Test
    void lectures_idempotentesEtErreurs() {
        manager.createRound(ADMIN);
        manager.placeBid(ALICE, 1L, SMALL_NUMBER, 100);

        assertThat(manager.round(1L)).isEqualTo(manager.round(1L));
        assertThat(manager.bid(1L, 1L)).isEqualTo(manager.bid(1L, 1L));
        assertThat(manager.roundCount()).isEqualTo(manager.roundCount());

        BidDetail b = manager.bid(1L, 1L);
        assertThat(b.getBettor()).isEqualTo(ALICE);
        assertThat(b.getSide()).isEqualTo(SMALL_NUMBER);
        assertThat(b.getStake()).isEqualTo(98);
        assertThat(b.isWon()).isFalse();
        assertThat(b.isFinished()).isFalse();

        assertThatThrownBy(() -> manager.round(42L)).isInstanceOf(RoundNotFoundException.class);
        assertThatThrownBy(() -> manager.bid(42L, 1L)).isInstanceOf(RoundNotFoundException.class);
        assertThatThrownBy(() -> manager.bid(1L, 9L)).isInstanceOf(BidNotFoundException.class);
    }
}
