package com.dotplatform.rating.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.repository.OrderRepository;
import com.dotplatform.rating.dto.CreateRatingRequest;
import com.dotplatform.rating.entity.Rating;
import com.dotplatform.rating.repository.RatingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Customer ratings of completed orders: score 1..5, one per order, only by the order's customer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RatingService {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    private final RatingRepository ratingRepository;
    private final OrderRepository orderRepository;

    @Transactional
    public Rating rate(AuthenticatedUser customer, CreateRatingRequest request) {
        if (request.score() < MIN_SCORE || request.score() > MAX_SCORE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Score must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }

        Order order = orderRepository.findById(request.orderId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (!order.isOwnedBy(customer.userId())) {
            throw new BusinessException(ErrorCode.NOT_AUTHORIZED, "Only the customer can rate this order");
        }
        if (order.getStatus() != OrderStatus.COMPLETED) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION, "Only completed orders can be rated");
        }
        if (ratingRepository.existsByOrderId(order.getId())) {
            throw new BusinessException(ErrorCode.ALREADY_RATED);
        }

        Rating rating = ratingRepository.save(Rating.builder()
                .orderId(order.getId())
                .customerId(customer.userId())
                .driverId(order.getDriverId())
                .score(request.score())
                .comment(request.comment())
                .build());

        log.info("Order rated: orderId={}, driverId={}, score={}", order.getId(), order.getDriverId(), request.score());
        return rating;
    }

    public List<Rating> getDriverRatings(Long driverId) {
        return ratingRepository.findByDriverIdOrderByCreatedAtDescIdDesc(driverId);
    }

    /**
     * Ratings given by a customer, or received by a driver.
     */
    public List<Rating> getMyRatings(AuthenticatedUser actor) {
        return switch (actor.role()) {
            case DRIVER -> ratingRepository.findByDriverIdOrderByCreatedAtDescIdDesc(actor.userId());
            case CUSTOMER -> ratingRepository.findByCustomerIdOrderByCreatedAtDescIdDesc(actor.userId());
            case ADMIN -> List.of();
        };
    }

    /**
     * Average score rounded to 2 decimals, null when the driver has no ratings.
     */
    public BigDecimal getAverageScore(Long driverId) {
        Double average = ratingRepository.findAverageScoreByDriverId(driverId);
        return average == null ? null : BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_UP);
    }
}
