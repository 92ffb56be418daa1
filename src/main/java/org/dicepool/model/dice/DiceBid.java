package org.dicepool.model.dice;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "dice_bid",
        uniqueConstraints = @UniqueConstraint(columnNames = {"round_id", "bid_id"}))
@Getter
@NoArgsConstructor
public class DiceBid {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long pk;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "round_id", nullable = false)
    private DiceRound round;

    // numéro séquentiel propre à la manche (1, 2, 3...)
    @Column(name = "bid_id", nullable = false)
    private long bidId;

    @Column(nullable = false)
    private String bettorEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BetSide side;

    // mise nette de frais ; ne fait que baisser (remboursements d'égalisation)
    @Column(nullable = false)
    private long stake;

    private boolean won;

    @Column(nullable = false)
    private Instant placedAt;

    DiceBid(DiceRound round, long bidId, String bettorEmail, BetSide side, long stake, Instant placedAt) {
        this.round = round;
        this.bidId = bidId;
        this.bettorEmail = bettorEmail;
        this.side = side;
        this.stake = stake;
        this.placedAt = placedAt;
    }

    public void reduceStake(long amount) {
        if (amount < 0 || amount > stake) {
            throw new IllegalArgumentException("Réduction de mise invalide : " + amount + " (mise " + stake + ")");
        }
        this.stake -= amount;
    }

    public void markWon() { this.won = true; }
}
