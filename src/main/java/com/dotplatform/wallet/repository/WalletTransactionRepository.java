package com.dotplatform.wallet.repository;

import com.dotplatform.wallet.entity.TransactionType;
import com.dotplatform.wallet.entity.WalletTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, Long> {

    List<WalletTransaction> findByWalletIdOrderByCreatedAtDescIdDesc(Long walletId, Pageable pageable);

    Optional<WalletTransaction> findFirstByOrderIdAndType(Long orderId, TransactionType type);

    boolean existsByOrderIdAndType(Long orderId, TransactionType type);
}
