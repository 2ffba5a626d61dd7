package com.dotplatform.order.service;

import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.event.OrderCreatedEvent;
import com.dotplatform.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Persists a fully priced order together with its first audit entry.
 * Callers resolve price and addresses before calling in, so the transaction covers only the inserts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderRegistrationService {

    private final OrderRepository orderRepository;
    private final OrderStatusLogService statusLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Order register(Order order, Long customerId) {
        Order saved = orderRepository.save(order);
        statusLogService.append(saved.getId(), null, OrderStatus.PENDING, customerId, "Order created");

        eventPublisher.publishEvent(new OrderCreatedEvent(saved.getId(), saved.getOrderType(),
                saved.getCustomerId(), saved.getRecipientPhone(), saved.getRecipientLocationToken(),
                LocalDateTime.now(clock)));

        log.info("Order created: orderId={}, type={}, customerId={}, price={}, commission={}",
                saved.getId(), saved.getOrderType(), customerId,
                saved.getEstimatedPrice(), saved.getCommission());
        return saved;
    }
}
