package com.dotplatform.order.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.order.dto.RecipientLocationRequest;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.event.RecipientLocationSubmittedEvent;
import com.dotplatform.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Accepts the drop-off point chosen by the recipient of a delivery through the SMS link.
 * The token is the only credential and can be used once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecipientLocationService {

    private final OrderRepository orderRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Order submitLocation(String token, RecipientLocationRequest request) {
        Order order = orderRepository.findByRecipientLocationTokenWithLock(token)
                .orElseThrow(() -> new BusinessException(ErrorCode.LOCATION_TOKEN_NOT_FOUND));
        if (order.getStatus().isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order is already " + order.getStatus());
        }
        if (order.isRecipientLocationSubmitted()) {
            throw new BusinessException(ErrorCode.LOCATION_TOKEN_USED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.submitRecipientLocation(request.latitude(), request.longitude(), request.address(), now);

        eventPublisher.publishEvent(new RecipientLocationSubmittedEvent(order.getId(), order.getCustomerId(),
                order.getDriverId(), order.getStatus(), order.getDropoffLatitude(), order.getDropoffLongitude(),
                order.getDropoffAddress(), now));

        log.info("Recipient location submitted: orderId={}", order.getId());
        return order;
    }
}
