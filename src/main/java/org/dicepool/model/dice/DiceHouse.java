package org.dicepool.model.dice;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Registre unique de la maison : autorité, frais, solde retenu, compteur de manches
 * et manche active. {@code activeRoundId == null} signifie qu'aucune manche n'est ouverte.
 */
@Entity
@Table(name = "dice_house")
@Getter
@Setter
@NoArgsConstructor
public class DiceHouse {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    @Column(nullable = false)
    private String authorityEmail;

    @Column(nullable = false)
    private int feePercent;

    @Column(nullable = false)
    private long solde;

    @Column(nullable = false)
    private long roundCounter;

    private Long activeRoundId;

    public DiceHouse(String authorityEmail, int feePercent) {
        this.authorityEmail = authorityEmail;
        this.feePercent = feePercent;
    }
}
