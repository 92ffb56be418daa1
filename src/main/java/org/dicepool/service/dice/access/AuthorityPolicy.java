package org.dicepool.service.dice.access;

import org.dicepool.service.dice.error.UnauthorizedException;

/**
 * Capacité d'autorité : qui a le droit d'ouvrir, d'égaliser et de résoudre les manches
 * et d'administrer la maison.
 */
public interface AuthorityPolicy {

    boolean isAuthority(String caller);

    default void ensureAuthority(String caller) {
        if (!isAuthority(caller)) throw new UnauthorizedException(caller);
    }
}
