package org.dicepool.repo;

import org.dicepool.model.dice.RoundEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RoundEventRepository extends JpaRepository<RoundEvent, Long> {
    List<RoundEvent> findAllByOrderByIdAsc();

    List<RoundEvent> findByRoundIdOrderByIdAsc(Long roundId);
}
