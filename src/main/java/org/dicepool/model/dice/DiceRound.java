package org.dicepool.model.dice;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "dice_round")
@Getter
@Setter
@NoArgsConstructor
public class DiceRound {

    // attribué par le moteur (compteur du registre), jamais par une séquence
    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RoundState state = RoundState.WAITING_FOR_BIDS;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RoundResult result = RoundResult.UNDETERMINED;

    private int dice1;
    private int dice2;
    private int dice3;
    private int totalPips;

    @Column(nullable = false)
    private long bigPoolTotal;

    @Column(nullable = false)
    private long smallPoolTotal;

    @Column(nullable = false)
    private long nextBidId = 1L;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant finishedAt;

    @OneToMany(mappedBy = "round", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("bidId ASC")
    private List<DiceBid> bids = new ArrayList<>();

    public DiceRound(Long id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public DiceBid addBid(String bettorEmail, BetSide side, long stake, Instant placedAt) {
        DiceBid bid = new DiceBid(this, nextBidId++, bettorEmail, side, stake, placedAt);
        bids.add(bid);
        addToPool(side, stake);
        return bid;
    }

    public void addToPool(BetSide side, long delta) {
        if (side == BetSide.BIG_NUMBER) bigPoolTotal += delta;
        else smallPoolTotal += delta;
    }

    public DiceBid bid(long bidId) {
        for (DiceBid b : bids) {
            if (b.getBidId() == bidId) return b;
        }
        return null;
    }

    /** Les dés, le total et le résultat ne s'écrivent qu'une fois. */
    public void recordRoll(int d1, int d2, int d3) {
        if (result != RoundResult.UNDETERMINED) {
            throw new IllegalStateException("Résultat déjà enregistré pour la manche " + id);
        }
        this.dice1 = d1;
        this.dice2 = d2;
        this.dice3 = d3;
        this.totalPips = d1 + d2 + d3;
        this.result = RoundResult.ofTotalPips(totalPips);
    }

    public List<Integer> getDice() {
        return List.of(dice1, dice2, dice3);
    }
}
