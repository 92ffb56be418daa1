package org.dicepool.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Réglages du moteur de dés (préfixe {@code dice}).
 * Le pourcentage de frais et l'autorité ne servent qu'à initialiser le registre
 * de la maison au premier démarrage ; ensuite c'est le registre qui fait foi.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "dice")
public class DiceProperties {

    /**
     * Frais prélevés sur chaque mise, en pourcentage (division entière).
     */
    private int feePercent = 2;

    /**
     * Une mise doit être strictement supérieure à ce montant.
     */
    private long minStake = 10L;

    /**
     * Email de l'autorité initiale.
     */
    private String authorityEmail = "admin@dicepool.local";

    /**
     * Ouvre la manche 1 au démarrage si aucune manche n'existe encore.
     */
    private boolean createFirstRound = false;
}
