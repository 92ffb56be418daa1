package org.dicepool.repo;

import org.dicepool.model.dice.DiceBid;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DiceBidRepository extends JpaRepository<DiceBid, Long> {
    Optional<DiceBid> findByRoundIdAndBidId(Long roundId, long bidId);
}
