package org.dicepool.repo;

import jakarta.persistence.LockModeType;
import org.dicepool.model.Utilisateur;
import org.dicepool.model.Wallet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface WalletRepository extends JpaRepository<Wallet, Long> {
    Optional<Wallet> findByUtilisateur(Utilisateur utilisateur);

    // verrou ligne : les crédits/débits se font sur l'entité, dans la transaction appelante
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select w from Wallet w where w.utilisateur = :u")
    Optional<Wallet> findForUpdate(@Param("u") Utilisateur utilisateur);
}
