package com.dotplatform.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Immutable record of one status transition. Every column is {@code updatable = false} and the
 * repository exposes no update or delete.
 *
 * <p>{@code entryHash} = SHA-256 over {@code previousHash} and the entry content, so rewriting
 * any past entry breaks every hash after it.</p>
 */
@Entity
@Table(name = "order_status_logs", indexes = {
        @Index(name = "idx_status_log_order_ts", columnList = "orderId, changedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderStatusLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 20)
    private OrderStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private OrderStatus newStatus;

    @Column(nullable = false, updatable = false)
    private Long changedBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime changedAt;

    @Column(updatable = false, length = 1000)
    private String notes;

    @Column(updatable = false, length = 64)
    private String previousHash;

    @Column(nullable = false, updatable = false, length = 64)
    private String entryHash;

    @Builder
    public OrderStatusLog(Long orderId, OrderStatus oldStatus, OrderStatus newStatus, Long changedBy,
                          LocalDateTime changedAt, String notes, String previousHash, String entryHash) {
        this.orderId = orderId;
        this.oldStatus = oldStatus;
        this.newStatus = newStatus;
        this.changedBy = changedBy;
        this.changedAt = changedAt;
        this.notes = notes;
        this.previousHash = previousHash;
        this.entryHash = entryHash;
    }
}
