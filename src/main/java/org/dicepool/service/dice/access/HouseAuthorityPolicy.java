package org.dicepool.service.dice.access;

import lombok.RequiredArgsConstructor;
import org.dicepool.service.dice.house.HouseService;
import org.springframework.stereotype.Component;

import java.util.Objects;

// L'autorité est l'email enregistré dans le registre de la maison
@Component
@RequiredArgsConstructor
public class HouseAuthorityPolicy implements AuthorityPolicy {
    private final HouseService house;

    @Override
    public boolean isAuthority(String caller) {
        return caller != null && Objects.equals(caller, house.authorityEmail());
    }
}
