package com.dotplatform.realtime.listener;

import com.dotplatform.common.security.UserRole;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.order.event.OrderCreatedEvent;
import com.dotplatform.order.event.OrderStatusChangedEvent;
import com.dotplatform.order.event.RecipientLocationSubmittedEvent;
import com.dotplatform.realtime.message.MessageType;
import com.dotplatform.realtime.message.RealtimeMessage;
import com.dotplatform.realtime.service.RealtimeBroadcaster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeEventListenerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock
    private RealtimeBroadcaster broadcaster;

    @InjectMocks
    private RealtimeEventListener listener;

    @Test
    @DisplayName("Status change reaches the customer, the assigned driver and the admin pool")
    void onOrderStatusChanged() {
        listener.onOrderStatusChanged(new OrderStatusChangedEvent(7L, OrderType.TAXI, 1L, 2L,
                OrderStatus.ACCEPTED, OrderStatus.PICKED_UP, 2L, NOW));

        verify(broadcaster).sendToUser(eq(1L), argThat(m -> m.type() == MessageType.ORDER_UPDATE));
        verify(broadcaster).sendToUser(eq(2L), argThat(m -> m.type() == MessageType.ORDER_UPDATE));
        verify(broadcaster).broadcastToRole(eq(UserRole.ADMIN), argThat(m -> m.type() == MessageType.ORDER_UPDATE));
        verifyNoMoreInteractions(broadcaster);
    }

    @Test
    @DisplayName("Cancellation of an unassigned order skips the driver")
    void onOrderStatusChanged_NoDriver() {
        listener.onOrderStatusChanged(new OrderStatusChangedEvent(7L, OrderType.TAXI, 1L, null,
                OrderStatus.PENDING, OrderStatus.CANCELLED, 1L, NOW));

        verify(broadcaster).sendToUser(eq(1L), any(RealtimeMessage.class));
        verify(broadcaster).broadcastToRole(eq(UserRole.ADMIN), any(RealtimeMessage.class));
        verifyNoMoreInteractions(broadcaster);
    }

    @Test
    @DisplayName("New order is announced to all drivers and admins")
    void onOrderCreated() {
        listener.onOrderCreated(new OrderCreatedEvent(7L, OrderType.DELIVERY, 1L, "+963912345678", "tok", NOW));

        verify(broadcaster).broadcastToRole(eq(UserRole.DRIVER), argThat(m -> m.type() == MessageType.NEW_ORDER));
        verify(broadcaster).broadcastToRole(eq(UserRole.ADMIN), argThat(m -> m.type() == MessageType.NEW_ORDER));
        verify(broadcaster, never()).sendToUser(any(), any());
    }

    @Test
    @DisplayName("Recipient drop-off update goes to the customer and the driver")
    void onRecipientLocationSubmitted() {
        listener.onRecipientLocationSubmitted(new RecipientLocationSubmittedEvent(7L, 1L, 2L,
                OrderStatus.ACCEPTED, 33.5, 36.3, "Mezzeh", NOW));

        verify(broadcaster).sendToUser(eq(1L), argThat(m -> m.type() == MessageType.ORDER_UPDATE));
        verify(broadcaster).sendToUser(eq(2L), argThat(m -> m.type() == MessageType.ORDER_UPDATE));
        verifyNoMoreInteractions(broadcaster);
    }
}
