package com.dotplatform.integration;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.UserRole;
import com.dotplatform.order.dto.CreateTaxiOrderRequest;
import com.dotplatform.order.dto.UpdateOrderStatusRequest;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderStatusLog;
import com.dotplatform.order.repository.OrderRepository;
import com.dotplatform.order.service.OrderService;
import com.dotplatform.order.service.OrderStatusLogService;
import com.dotplatform.pricing.service.MapsService;
import com.dotplatform.wallet.entity.TransactionType;
import com.dotplatform.wallet.entity.WalletTransaction;
import com.dotplatform.wallet.repository.WalletTransactionRepository;
import com.dotplatform.wallet.service.DeductionResult;
import com.dotplatform.wallet.service.WalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

/**
 * End-to-end order flow against the real persistence layer. Only the maps provider is mocked.
 * Each test uses its own user ids so the shared database needs no cleanup.
 */
@SpringBootTest
@ActiveProfiles("test")
class OrderLifecycleIntegrationTest {

    private static final Long ADMIN_ID = 900L;

    @Autowired
    private OrderService orderService;
    @Autowired
    private OrderStatusLogService statusLogService;
    @Autowired
    private WalletService walletService;
    @Autowired
    private OrderRepository orderRepository;
    @Autowired
    private WalletTransactionRepository transactionRepository;

    @MockBean
    private MapsService mapsService;

    @BeforeEach
    void setUp() {
        given(mapsService.getDistanceKm(any(), any())).willReturn(Optional.of(new BigDecimal("10.000")));
    }

    @Test
    @DisplayName("Taxi order runs PENDING to COMPLETED with one commission deduction and an intact audit chain")
    void fullLifecycle() {
        // Given
        AuthenticatedUser customer = customer(101L);
        AuthenticatedUser driver = driver(201L);
        walletService.topUp(driver.userId(), new BigDecimal("10000"), ADMIN_ID);

        // When
        Order order = orderService.createTaxiOrder(customer, taxiRequest());
        orderService.acceptOrder(driver, order.getId());
        orderService.updateOrderStatus(driver, order.getId(), new UpdateOrderStatusRequest(OrderStatus.PICKED_UP, null));
        orderService.updateOrderStatus(driver, order.getId(), new UpdateOrderStatusRequest(OrderStatus.IN_TRANSIT, null));
        orderService.updateOrderStatus(driver, order.getId(), new UpdateOrderStatusRequest(OrderStatus.DELIVERED, null));
        orderService.updateOrderStatus(driver, order.getId(),
                new UpdateOrderStatusRequest(OrderStatus.COMPLETED, "Paid in cash"));

        // Then
        Order completed = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(completed.getEstimatedPrice()).isEqualByComparingTo("55000.00");
        assertThat(completed.getFinalPrice()).isEqualByComparingTo("55000.00");
        assertThat(completed.getCompletedAt()).isNotNull();

        assertThat(walletService.getBalance(driver.userId())).isEqualByComparingTo("5000.00");
        assertThat(transactionRepository.existsByOrderIdAndType(order.getId(), TransactionType.DEDUCTION)).isTrue();

        assertThat(statusLogService.getHistory(order.getId()))
                .extracting(OrderStatusLog::getNewStatus)
                .containsExactly(OrderStatus.PENDING, OrderStatus.ACCEPTED, OrderStatus.PICKED_UP,
                        OrderStatus.IN_TRANSIT, OrderStatus.DELIVERED, OrderStatus.COMPLETED);
        assertThat(statusLogService.verifyChain(order.getId())).isTrue();
    }

    @Test
    @DisplayName("Completion without enough balance is rolled back and leaves no trace")
    void declinedCompletionRollsBack() {
        // Given
        AuthenticatedUser customer = customer(102L);
        AuthenticatedUser driver = driver(202L);
        walletService.topUp(driver.userId(), new BigDecimal("5000"), ADMIN_ID);

        Order first = orderService.createTaxiOrder(customer, taxiRequest());
        Order second = orderService.createTaxiOrder(customer, taxiRequest());
        deliver(driver, first);
        deliver(driver, second);
        orderService.updateOrderStatus(driver, first.getId(), new UpdateOrderStatusRequest(OrderStatus.COMPLETED, null));

        // When & Then
        assertThatThrownBy(() -> orderService.updateOrderStatus(driver, second.getId(),
                new UpdateOrderStatusRequest(OrderStatus.COMPLETED, null)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);

        assertThat(orderRepository.findById(second.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.DELIVERED);
        assertThat(statusLogService.getHistory(second.getId()))
                .extracting(OrderStatusLog::getNewStatus)
                .doesNotContain(OrderStatus.COMPLETED);
        assertThat(transactionRepository.existsByOrderIdAndType(second.getId(), TransactionType.DEDUCTION)).isFalse();
        assertThat(walletService.getBalance(driver.userId())).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Driver below the commission threshold can neither list nor accept orders")
    void eligibilityGate() {
        // Given
        AuthenticatedUser customer = customer(103L);
        AuthenticatedUser driver = driver(203L);
        walletService.topUp(driver.userId(), new BigDecimal("4999.99"), ADMIN_ID);
        Order order = orderService.createTaxiOrder(customer, taxiRequest());

        // When & Then
        assertThatThrownBy(() -> orderService.getPendingOrders(driver))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThatThrownBy(() -> orderService.acceptOrder(driver, order.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);

        walletService.topUp(driver.userId(), new BigDecimal("0.01"), ADMIN_ID);
        assertThat(orderService.getPendingOrders(driver)).extracting(Order::getId).contains(order.getId());
    }

    @Test
    @DisplayName("Top-up followed by a deduction of the same amount returns the balance to where it was")
    void topUpThenDeduct() {
        Long driverId = 204L;
        walletService.getOrCreateWallet(driverId);

        walletService.topUp(driverId, new BigDecimal("100"), ADMIN_ID);
        DeductionResult result = walletService.deductCommission(driverId, new BigDecimal("100"), 424242L);

        assertThat(result.approved()).isTrue();
        assertThat(walletService.getBalance(driverId)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(walletService.getTransactions(driverId, null))
                .extracting(WalletTransaction::getType)
                .containsExactlyInAnyOrder(TransactionType.TOP_UP, TransactionType.DEDUCTION);
    }

    @Test
    @DisplayName("Only the customer or the assigned driver may cancel")
    void cancelPermissions() {
        // Given
        AuthenticatedUser customer = customer(105L);
        AuthenticatedUser stranger = customer(106L);
        AuthenticatedUser driver = driver(205L);
        walletService.topUp(driver.userId(), new BigDecimal("5000"), ADMIN_ID);
        Order order = orderService.createTaxiOrder(customer, taxiRequest());
        orderService.acceptOrder(driver, order.getId());

        // When & Then
        assertThatThrownBy(() -> orderService.cancelOrder(stranger, order.getId(), "not mine"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_AUTHORIZED);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.ACCEPTED);

        Order cancelled = orderService.cancelOrder(driver, order.getId(), "vehicle breakdown");
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.getCancelledBy()).isEqualTo(driver.userId());
        assertThat(statusLogService.verifyChain(order.getId())).isTrue();
    }

    @Test
    @DisplayName("Commission of a completed order can be refunded once")
    void refundOnce() {
        // Given
        AuthenticatedUser customer = customer(107L);
        AuthenticatedUser driver = driver(207L);
        walletService.topUp(driver.userId(), new BigDecimal("5000"), ADMIN_ID);
        Order order = orderService.createTaxiOrder(customer, taxiRequest());
        deliver(driver, order);
        orderService.updateOrderStatus(driver, order.getId(), new UpdateOrderStatusRequest(OrderStatus.COMPLETED, null));

        // When
        walletService.refundCommission(order.getId(), ADMIN_ID, "disputed trip");

        // Then
        assertThat(walletService.getBalance(driver.userId())).isEqualByComparingTo("5000.00");
        assertThatThrownBy(() -> walletService.refundCommission(order.getId(), ADMIN_ID, null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ALREADY_REFUNDED);
    }

    @Test
    @DisplayName("Maps calls during order creation run with no open transaction")
    void createOrder_MapsCallsOutsideTransaction() {
        // Given
        List<Boolean> transactionActive = new CopyOnWriteArrayList<>();
        given(mapsService.getDistanceKm(any(), any())).willAnswer(inv -> {
            transactionActive.add(TransactionSynchronizationManager.isActualTransactionActive());
            return Optional.of(new BigDecimal("10.000"));
        });
        given(mapsService.reverseGeocode(any())).willAnswer(inv -> {
            transactionActive.add(TransactionSynchronizationManager.isActualTransactionActive());
            return Optional.of("Damascus, Syria");
        });

        // When
        Order order = orderService.createTaxiOrder(customer(108L),
                new CreateTaxiOrderRequest(33.5138, 36.2765, null, 33.4942, 36.3120, null));

        // Then
        assertThat(transactionActive).hasSize(3).containsOnly(false);
        Order stored = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(stored.getPickupAddress()).isEqualTo("Damascus, Syria");
        assertThat(statusLogService.getHistory(order.getId()))
                .extracting(OrderStatusLog::getNewStatus)
                .containsExactly(OrderStatus.PENDING);
    }

    private void deliver(AuthenticatedUser driver, Order order) {
        orderService.acceptOrder(driver, order.getId());
        orderService.updateOrderStatus(driver, order.getId(), new UpdateOrderStatusRequest(OrderStatus.PICKED_UP, null));
        orderService.updateOrderStatus(driver, order.getId(), new UpdateOrderStatusRequest(OrderStatus.DELIVERED, null));
    }

    private static CreateTaxiOrderRequest taxiRequest() {
        return new CreateTaxiOrderRequest(33.5138, 36.2765, "Umayyad Square", 33.4942, 36.3120, "Bab Touma");
    }

    private static AuthenticatedUser customer(Long id) {
        return new AuthenticatedUser(id, UserRole.CUSTOMER);
    }

    private static AuthenticatedUser driver(Long id) {
        return new AuthenticatedUser(id, UserRole.DRIVER);
    }
}
