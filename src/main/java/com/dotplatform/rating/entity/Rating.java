package com.dotplatform.rating.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "ratings", indexes = {
        @Index(name = "idx_rating_driver", columnList = "driverId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Rating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // One rating per order
    @Column(nullable = false, unique = true, updatable = false)
    private Long orderId;

    @Column(nullable = false, updatable = false)
    private Long customerId;

    @Column(nullable = false, updatable = false)
    private Long driverId;

    @Column(nullable = false, updatable = false)
    private Integer score;

    @Column(length = 1000, updatable = false)
    private String comment;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public Rating(Long orderId, Long customerId, Long driverId, Integer score, String comment) {
        this.orderId = orderId;
        this.customerId = customerId;
        this.driverId = driverId;
        this.score = score;
        this.comment = comment;
    }
}
