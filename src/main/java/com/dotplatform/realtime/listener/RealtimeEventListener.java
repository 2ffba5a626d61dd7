package com.dotplatform.realtime.listener;

import com.dotplatform.common.config.AsyncConfig;
import com.dotplatform.common.security.UserRole;
import com.dotplatform.order.event.OrderCreatedEvent;
import com.dotplatform.order.event.OrderStatusChangedEvent;
import com.dotplatform.order.event.RecipientLocationSubmittedEvent;
import com.dotplatform.realtime.message.DropoffUpdatePayload;
import com.dotplatform.realtime.message.MessageType;
import com.dotplatform.realtime.message.NewOrderPayload;
import com.dotplatform.realtime.message.OrderUpdatePayload;
import com.dotplatform.realtime.message.RealtimeMessage;
import com.dotplatform.realtime.service.RealtimeBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges committed order changes to the broadcaster.
 *
 * <pre>
 *   order_update → customer, assigned driver, admin pool
 *   new_order    → all drivers, admin pool
 * </pre>
 *
 * Runs on the realtime executor only after the order transaction committed, so a rolled-back
 * transition is never announced and a slow client never delays a commit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeEventListener {

    private final RealtimeBroadcaster broadcaster;

    @Async(AsyncConfig.REALTIME_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        RealtimeMessage message = new RealtimeMessage(MessageType.ORDER_UPDATE, OrderUpdatePayload.from(event));

        broadcaster.sendToUser(event.customerId(), message);
        if (event.driverId() != null) {
            broadcaster.sendToUser(event.driverId(), message);
        }
        broadcaster.broadcastToRole(UserRole.ADMIN, message);
        log.debug("order_update broadcast: orderId={}, status={}", event.orderId(), event.status());
    }

    @Async(AsyncConfig.REALTIME_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderCreated(OrderCreatedEvent event) {
        RealtimeMessage message = new RealtimeMessage(MessageType.NEW_ORDER,
                new NewOrderPayload(event.orderId(), event.orderType(), event.createdAt()));

        broadcaster.broadcastToRole(UserRole.DRIVER, message);
        broadcaster.broadcastToRole(UserRole.ADMIN, message);
        log.debug("new_order broadcast: orderId={}", event.orderId());
    }

    @Async(AsyncConfig.REALTIME_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRecipientLocationSubmitted(RecipientLocationSubmittedEvent event) {
        RealtimeMessage message = new RealtimeMessage(MessageType.ORDER_UPDATE, DropoffUpdatePayload.from(event));

        broadcaster.sendToUser(event.customerId(), message);
        if (event.driverId() != null) {
            broadcaster.sendToUser(event.driverId(), message);
        }
    }
}
