package org.dicepool.repo;

import org.dicepool.model.dice.DiceHouse;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DiceHouseRepository extends JpaRepository<DiceHouse, Long> {
}
