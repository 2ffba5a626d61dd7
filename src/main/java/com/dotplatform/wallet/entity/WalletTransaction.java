package com.dotplatform.wallet.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only ledger entry. Amount is always positive; the type gives the direction.
 */
@Entity
@Table(name = "wallet_transactions", indexes = {
        @Index(name = "idx_wallet_tx_wallet_created", columnList = "wallet_id, createdAt"),
        @Index(name = "idx_wallet_tx_order", columnList = "orderId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class WalletTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "wallet_id", nullable = false, updatable = false)
    private Wallet wallet;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private TransactionType type;

    @Column(nullable = false, updatable = false, precision = 19, scale = Wallet.MONEY_SCALE)
    private BigDecimal amount;

    @Column(updatable = false)
    private String description;

    @Column(updatable = false)
    private Long orderId;

    @Column(updatable = false)
    private Long adminId;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public WalletTransaction(Wallet wallet, TransactionType type, BigDecimal amount,
                             String description, Long orderId, Long adminId) {
        this.wallet = wallet;
        this.type = type;
        this.amount = amount;
        this.description = description;
        this.orderId = orderId;
        this.adminId = adminId;
    }
}
