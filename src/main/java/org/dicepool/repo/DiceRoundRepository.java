package org.dicepool.repo;

import org.dicepool.model.dice.DiceRound;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface DiceRoundRepository extends JpaRepository<DiceRound, Long> {

    @Query("select distinct r from DiceRound r left join fetch r.bids where r.id = :id")
    Optional<DiceRound> findWithBids(@Param("id") Long id);
}
