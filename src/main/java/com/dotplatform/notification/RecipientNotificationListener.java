package com.dotplatform.notification;

import com.dotplatform.common.config.AsyncConfig;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.order.event.OrderCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sends the recipient of a new delivery order the link for choosing the drop-off point.
 * Runs after the order is committed; a failed send is logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipientNotificationListener {

    private final SmsSender smsSender;

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderCreated(OrderCreatedEvent event) {
        if (event.orderType() != OrderType.DELIVERY || event.recipientPhone() == null) {
            return;
        }
        try {
            boolean sent = smsSender.sendLocationLink(
                    event.recipientPhone(), event.recipientLocationToken(), event.orderId());
            if (!sent) {
                log.warn("Location link SMS not delivered: orderId={}", event.orderId());
            }
        } catch (RuntimeException e) {
            log.warn("Location link SMS failed: orderId={}, cause={}", event.orderId(), e.toString());
        }
    }
}
