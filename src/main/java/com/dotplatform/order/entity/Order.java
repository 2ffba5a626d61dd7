package com.dotplatform.order.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Taxi or delivery order.
 *
 * <ul>
 *   <li>Customer and driver are external identities, stored by id only.</li>
 *   <li>{@code commission} is captured at creation and never changes.</li>
 *   <li>{@code driverId} is assigned exactly once, on acceptance.</li>
 *   <li>Status changes go through {@code OrderService}, which checks the transition table and
 *       holds the row lock; the mutators here only record the outcome.</li>
 * </ul>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_status_created", columnList = "status, createdAt"),
        @Index(name = "idx_order_customer", columnList = "customerId"),
        @Index(name = "idx_order_driver", columnList = "driverId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(nullable = false, updatable = false)
    private Long customerId;

    private Long driverId;

    @Column(nullable = false)
    private Double pickupLatitude;

    @Column(nullable = false)
    private Double pickupLongitude;

    private String pickupAddress;

    @Column(nullable = false)
    private Double dropoffLatitude;

    @Column(nullable = false)
    private Double dropoffLongitude;

    private String dropoffAddress;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal estimatedPrice;

    @Column(precision = 19, scale = 2)
    private BigDecimal finalPrice;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commission;

    // Delivery only
    private String recipientName;

    private String recipientPhone;

    @Column(length = 1000)
    private String itemDescription;

    @Column(precision = 19, scale = 2)
    private BigDecimal itemPrice;

    @JsonIgnore
    @Column(unique = true, updatable = false, length = 64)
    private String recipientLocationToken;

    private LocalDateTime recipientLocationSubmittedAt;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime acceptedAt;

    private LocalDateTime pickedUpAt;

    private LocalDateTime inTransitAt;

    private LocalDateTime deliveredAt;

    private LocalDateTime completedAt;

    private LocalDateTime cancelledAt;

    private Long cancelledBy;

    @Column(length = 1000)
    private String cancellationReason;

    @Builder
    public Order(OrderType orderType, Long customerId,
                 Double pickupLatitude, Double pickupLongitude, String pickupAddress,
                 Double dropoffLatitude, Double dropoffLongitude, String dropoffAddress,
                 BigDecimal estimatedPrice, BigDecimal commission,
                 String recipientName, String recipientPhone,
                 String itemDescription, BigDecimal itemPrice,
                 String recipientLocationToken) {
        this.orderType = orderType;
        this.status = OrderStatus.PENDING;
        this.customerId = customerId;
        this.pickupLatitude = pickupLatitude;
        this.pickupLongitude = pickupLongitude;
        this.pickupAddress = pickupAddress;
        this.dropoffLatitude = dropoffLatitude;
        this.dropoffLongitude = dropoffLongitude;
        this.dropoffAddress = dropoffAddress;
        this.estimatedPrice = estimatedPrice;
        this.commission = commission;
        this.recipientName = recipientName;
        this.recipientPhone = recipientPhone;
        this.itemDescription = itemDescription;
        this.itemPrice = itemPrice;
        this.recipientLocationToken = recipientLocationToken;
    }

    public boolean isAssignedTo(Long userId) {
        return driverId != null && driverId.equals(userId);
    }

    public boolean isOwnedBy(Long userId) {
        return customerId.equals(userId);
    }

    public void accept(Long driverId, LocalDateTime now) {
        this.driverId = driverId;
        this.status = OrderStatus.ACCEPTED;
        this.acceptedAt = now;
    }

    public void progressTo(OrderStatus next, LocalDateTime now) {
        switch (next) {
            case PICKED_UP -> this.pickedUpAt = now;
            case IN_TRANSIT -> this.inTransitAt = now;
            case DELIVERED -> this.deliveredAt = now;
            case COMPLETED -> {
                this.completedAt = now;
                this.finalPrice = estimatedPrice;
            }
            default -> throw new IllegalArgumentException("Not a progress status: " + next);
        }
        this.status = next;
    }

    public void cancel(Long cancelledBy, String reason, LocalDateTime now) {
        this.status = OrderStatus.CANCELLED;
        this.cancelledBy = cancelledBy;
        this.cancellationReason = reason;
        this.cancelledAt = now;
    }

    public boolean isRecipientLocationSubmitted() {
        return recipientLocationSubmittedAt != null;
    }

    public void submitRecipientLocation(Double latitude, Double longitude, String address, LocalDateTime now) {
        this.dropoffLatitude = latitude;
        this.dropoffLongitude = longitude;
        if (address != null && !address.isBlank()) {
            this.dropoffAddress = address;
        }
        this.recipientLocationSubmittedAt = now;
    }
}
