package com.dotplatform.order.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.order.dto.RecipientLocationRequest;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.order.event.RecipientLocationSubmittedEvent;
import com.dotplatform.order.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RecipientLocationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String TOKEN = "x7Lq2mV9pT4sN8rK1wZ6yB3cF5hJ0dG2aE7uQ9iO4nM";

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private RecipientLocationService recipientLocationService;

    @BeforeEach
    void setUp() {
        recipientLocationService = new RecipientLocationService(orderRepository, eventPublisher, CLOCK);
    }

    @Test
    @DisplayName("Recipient sets the drop-off point once and the change is announced")
    void submitLocation_Success() {
        // Given
        Order order = deliveryOrder();
        given(orderRepository.findByRecipientLocationTokenWithLock(TOKEN)).willReturn(Optional.of(order));

        // When
        Order result = recipientLocationService.submitLocation(TOKEN,
                new RecipientLocationRequest(33.52, 36.28, "Mezzeh, Damascus"));

        // Then
        assertThat(result.getDropoffLatitude()).isEqualTo(33.52);
        assertThat(result.getDropoffAddress()).isEqualTo("Mezzeh, Damascus");
        assertThat(result.isRecipientLocationSubmitted()).isTrue();
        assertThat(result.getRecipientLocationSubmittedAt()).isEqualTo(LocalDateTime.now(CLOCK));

        ArgumentCaptor<RecipientLocationSubmittedEvent> captor =
                ArgumentCaptor.forClass(RecipientLocationSubmittedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().orderId()).isEqualTo(11L);
        assertThat(captor.getValue().customerId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Unknown token is rejected")
    void submitLocation_UnknownToken() {
        given(orderRepository.findByRecipientLocationTokenWithLock("nope")).willReturn(Optional.empty());

        assertThatThrownBy(() -> recipientLocationService.submitLocation("nope",
                new RecipientLocationRequest(33.52, 36.28, null)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.LOCATION_TOKEN_NOT_FOUND);
    }

    @Test
    @DisplayName("A token can be used only once")
    void submitLocation_AlreadyUsed() {
        Order order = deliveryOrder();
        order.submitRecipientLocation(33.52, 36.28, null, LocalDateTime.now(CLOCK));
        given(orderRepository.findByRecipientLocationTokenWithLock(TOKEN)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> recipientLocationService.submitLocation(TOKEN,
                new RecipientLocationRequest(33.6, 36.3, null)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.LOCATION_TOKEN_USED);
        assertThat(order.getDropoffLatitude()).isEqualTo(33.52);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("Cancelled order no longer accepts a location")
    void submitLocation_Cancelled() {
        Order order = deliveryOrder();
        order.cancel(1L, "changed my mind", LocalDateTime.now(CLOCK));
        given(orderRepository.findByRecipientLocationTokenWithLock(TOKEN)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> recipientLocationService.submitLocation(TOKEN,
                new RecipientLocationRequest(33.52, 36.28, null)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_TRANSITION);
    }

    private static Order deliveryOrder() {
        Order order = Order.builder()
                .orderType(OrderType.DELIVERY)
                .customerId(1L)
                .pickupLatitude(33.5)
                .pickupLongitude(36.3)
                .dropoffLatitude(33.51)
                .dropoffLongitude(36.29)
                .dropoffAddress("Recipient address pending")
                .estimatedPrice(new BigDecimal("11640.00"))
                .commission(new BigDecimal("5000.00"))
                .recipientName("Lina")
                .recipientPhone("+963912345678")
                .itemDescription("Documents")
                .recipientLocationToken(TOKEN)
                .build();
        ReflectionTestUtils.setField(order, "id", 11L);
        return order;
    }
}
