package com.dotplatform.wallet.repository;

import com.dotplatform.wallet.entity.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WalletRepository extends JpaRepository<Wallet, Long> {

    Optional<Wallet> findByDriverId(Long driverId);

    /**
     * SELECT ... FOR UPDATE on the driver's wallet row. Every balance read-modify-write runs
     * behind this lock, so a balance check and the debit that follows it cannot interleave with
     * another mutation of the same wallet. Other wallets are not affected.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.driverId = :driverId")
    Optional<Wallet> findByDriverIdWithLock(@Param("driverId") Long driverId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.id = :id")
    Optional<Wallet> findByIdWithLock(@Param("id") Long id);

    List<Wallet> findAllByOrderByDriverIdAsc();
}
