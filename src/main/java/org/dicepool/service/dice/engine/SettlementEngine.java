package org.dicepool.service.dice.engine;

import org.dicepool.model.dice.BetSide;
import org.dicepool.model.dice.DiceBid;
import org.dicepool.model.dice.RoundResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Calculs purs sur les mises d'une manche : égalisation des pools puis paiement des gagnants.
 * Ne modifie rien ; le {@link RoundManager} applique le résultat.
 */
@Component
public class SettlementEngine {

    /** Vue figée d'une mise, dans l'ordre de placement. */
    public record StakeLine(long bidId, BetSide side, long stake) {
        public static StakeLine of(DiceBid bid) {
            return new StakeLine(bid.getBidId(), bid.getSide(), bid.getStake());
        }
    }

    public record Refund(long bidId, long amount) {}

    public record EqualizationOutcome(long bigPoolTotal, long smallPoolTotal, List<Refund> refunds) {}

    public record Payout(long bidId, long amount, boolean winner) {}

    public static List<StakeLine> linesOf(List<DiceBid> bids) {
        List<StakeLine> lines = new ArrayList<>(bids.size());
        for (DiceBid b : bids) lines.add(StakeLine.of(b));
        return lines;
    }

    /**
     * Ramène le pool le plus lourd au niveau du plus léger. L'excédent est rendu en partant
     * de la mise la plus récente du côté lourd : les premières mises sont remboursées en dernier.
     */
    public EqualizationOutcome equalize(long bigPoolTotal, long smallPoolTotal, List<StakeLine> orderedBids) {
        if (bigPoolTotal == smallPoolTotal) {
            return new EqualizationOutcome(bigPoolTotal, smallPoolTotal, Collections.emptyList());
        }

        BetSide heavy = bigPoolTotal > smallPoolTotal ? BetSide.BIG_NUMBER : BetSide.SMALL_NUMBER;
        long deficit = Math.abs(bigPoolTotal - smallPoolTotal);

        List<Refund> refunds = new ArrayList<>();
        long remaining = deficit;
        for (int i = orderedBids.size() - 1; i >= 0 && remaining > 0; i--) {
            StakeLine line = orderedBids.get(i);
            if (line.side() != heavy) continue;

            long refund = Math.min(remaining, line.stake());
            remaining -= refund;
            if (refund > 0) refunds.add(new Refund(line.bidId(), refund));
        }

        // le pool lourd baisse exactement du déficit, même si les mises n'ont pas tout absorbé
        long newBig = heavy == BetSide.BIG_NUMBER ? bigPoolTotal - deficit : bigPoolTotal;
        long newSmall = heavy == BetSide.SMALL_NUMBER ? smallPoolTotal - deficit : smallPoolTotal;
        return new EqualizationOutcome(newBig, newSmall, refunds);
    }

    /**
     * Une ligne par mise, dans l'ordre des numéros : le gagnant touche deux fois sa mise,
     * le perdant rien. Un gain qui dépasse {@code long} lève {@link ArithmeticException}.
     */
    public List<Payout> computePayouts(RoundResult result, List<StakeLine> orderedBids) {
        List<Payout> payouts = new ArrayList<>(orderedBids.size());
        for (StakeLine line : orderedBids) {
            boolean winner = line.side().wins(result);
            payouts.add(new Payout(line.bidId(), winner ? Math.multiplyExact(2L, line.stake()) : 0L, winner));
        }
        return payouts;
    }
}
