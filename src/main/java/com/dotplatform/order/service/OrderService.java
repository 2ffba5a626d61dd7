package com.dotplatform.order.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.UserRole;
import com.dotplatform.order.dto.CreateDeliveryOrderRequest;
import com.dotplatform.order.dto.CreateTaxiOrderRequest;
import com.dotplatform.order.dto.UpdateOrderStatusRequest;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderStatusLog;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.order.event.OrderStatusChangedEvent;
import com.dotplatform.order.repository.OrderRepository;
import com.dotplatform.pricing.service.Coordinates;
import com.dotplatform.pricing.service.MapsService;
import com.dotplatform.pricing.service.PricingService;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.service.PlatformSettingService;
import com.dotplatform.wallet.service.DeductionResult;
import com.dotplatform.wallet.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;

/**
 * Order state machine.
 *
 * <h3>Transaction shape of a transition</h3>
 * <pre>
 *   BEGIN
 *     SELECT ... FOR UPDATE orders          lock the order row, read current status
 *     check actor + transition table
 *     [COMPLETED] WalletService.deductCommission   wallet row lock, debit + DEDUCTION row
 *     UPDATE orders                          status + timestamp
 *     INSERT order_status_logs               audit entry, last
 *     publish OrderStatusChangedEvent        delivered to listeners after commit
 *   COMMIT
 * </pre>
 *
 * <ul>
 *   <li>Any {@link BusinessException} rolls the whole transaction back, so a declined
 *       commission leaves the order in its previous status with no audit entry.</li>
 *   <li>The real-time broadcast runs after commit on its own executor. It never extends or
 *       fails this transaction.</li>
 *   <li>Order creation prices and geocodes with no transaction open, then hands the finished
 *       order to {@link OrderRegistrationService} for the inserts. A slow maps provider holds
 *       neither a pooled connection nor a row lock.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 32;

    private final OrderRepository orderRepository;
    private final OrderStatusLogService statusLogService;
    private final OrderRegistrationService registrationService;
    private final WalletService walletService;
    private final PricingService pricingService;
    private final MapsService mapsService;
    private final PlatformSettingService settingService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Order createTaxiOrder(AuthenticatedUser customer, CreateTaxiOrderRequest request) {
        customer.requireRole(UserRole.CUSTOMER);
        Coordinates pickup = new Coordinates(request.pickupLatitude(), request.pickupLongitude());
        Coordinates dropoff = new Coordinates(request.dropoffLatitude(), request.dropoffLongitude());

        BigDecimal price = pricingService.estimatePrice(OrderType.TAXI, pickup, dropoff);

        Order order = Order.builder()
                .orderType(OrderType.TAXI)
                .customerId(customer.userId())
                .pickupLatitude(pickup.latitude())
                .pickupLongitude(pickup.longitude())
                .pickupAddress(resolveAddress(request.pickupAddress(), pickup))
                .dropoffLatitude(dropoff.latitude())
                .dropoffLongitude(dropoff.longitude())
                .dropoffAddress(resolveAddress(request.dropoffAddress(), dropoff))
                .estimatedPrice(price)
                .commission(settingService.getDecimal(SettingKey.DEFAULT_COMMISSION))
                .build();

        return registrationService.register(order, customer.userId());
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Order createDeliveryOrder(AuthenticatedUser customer, CreateDeliveryOrderRequest request) {
        customer.requireRole(UserRole.CUSTOMER);
        Coordinates pickup = new Coordinates(request.pickupLatitude(), request.pickupLongitude());
        Coordinates dropoff = new Coordinates(request.dropoffLatitude(), request.dropoffLongitude());

        BigDecimal price = pricingService.estimatePrice(OrderType.DELIVERY, pickup, dropoff);

        Order order = Order.builder()
                .orderType(OrderType.DELIVERY)
                .customerId(customer.userId())
                .pickupLatitude(pickup.latitude())
                .pickupLongitude(pickup.longitude())
                .pickupAddress(resolveAddress(request.pickupAddress(), pickup))
                .dropoffLatitude(dropoff.latitude())
                .dropoffLongitude(dropoff.longitude())
                .dropoffAddress(resolveAddress(request.dropoffAddress(), dropoff))
                .estimatedPrice(price)
                .commission(settingService.getDecimal(SettingKey.DEFAULT_COMMISSION))
                .recipientName(request.recipientName())
                .recipientPhone(request.recipientPhone())
                .itemDescription(request.itemDescription())
                .itemPrice(request.itemPrice())
                .recipientLocationToken(generateLocationToken())
                .build();

        return registrationService.register(order, customer.userId());
    }

    /**
     * Pending orders, newest first. The eligibility check runs before any order data is read.
     */
    public List<Order> getPendingOrders(AuthenticatedUser driver) {
        driver.requireRole(UserRole.DRIVER);
        requireEligible(driver.userId());
        return orderRepository.findByStatusOrderByCreatedAtDescIdDesc(OrderStatus.PENDING);
    }

    /**
     * First accept wins. The order row lock serializes competing drivers; whoever reads
     * PENDING under the lock takes the order, everyone after gets ORDER_NOT_AVAILABLE.
     */
    @Transactional
    public Order acceptOrder(AuthenticatedUser driver, Long orderId) {
        driver.requireRole(UserRole.DRIVER);
        requireEligible(driver.userId());

        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (order.getStatus() != OrderStatus.PENDING) {
            log.warn("Order not available: orderId={}, status={}, driverId={}",
                    orderId, order.getStatus(), driver.userId());
            throw new BusinessException(ErrorCode.ORDER_NOT_AVAILABLE);
        }

        order.accept(driver.userId(), now());
        recordTransition(order, OrderStatus.PENDING, driver.userId(), null);

        log.info("Order accepted: orderId={}, driverId={}", orderId, driver.userId());
        return order;
    }

    @Transactional
    public Order updateOrderStatus(AuthenticatedUser driver, Long orderId, UpdateOrderStatusRequest request) {
        OrderStatus target = request.status();
        if (!target.isDriverProgressStatus()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Status " + target + " cannot be set through a status update");
        }

        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (!driver.hasRole(UserRole.DRIVER) || !order.isAssignedTo(driver.userId())) {
            throw new BusinessException(ErrorCode.NOT_AUTHORIZED, "Only the assigned driver can update this order");
        }

        OrderStatus current = order.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Cannot change status from " + current + " to " + target);
        }

        if (target == OrderStatus.COMPLETED) {
            DeductionResult deduction = walletService.deductCommission(
                    driver.userId(), order.getCommission(), orderId);
            if (!deduction.approved()) {
                throw new BusinessException(ErrorCode.INSUFFICIENT_BALANCE,
                        "Wallet balance " + deduction.balance() + " does not cover commission "
                                + order.getCommission());
            }
        }

        order.progressTo(target, now());
        recordTransition(order, current, driver.userId(), request.notes());

        log.info("Order status updated: orderId={}, {} -> {}, driverId={}", orderId, current, target, driver.userId());
        return order;
    }

    /**
     * Only the customer or the assigned driver may cancel, and only before a terminal status.
     * No ledger entry is involved.
     */
    @Transactional
    public Order cancelOrder(AuthenticatedUser actor, Long orderId, String reason) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (!order.isOwnedBy(actor.userId()) && !order.isAssignedTo(actor.userId())) {
            throw new BusinessException(ErrorCode.NOT_AUTHORIZED, "Not authorized to cancel this order");
        }

        OrderStatus current = order.getStatus();
        if (current.isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION, "Cannot cancel order in status " + current);
        }

        order.cancel(actor.userId(), reason, now());
        recordTransition(order, current, actor.userId(), reason);

        log.info("Order cancelled: orderId={}, from={}, by={}", orderId, current, actor.userId());
        return order;
    }

    public Order getOrder(AuthenticatedUser actor, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        requireViewer(actor, order);
        return order;
    }

    public List<Order> getMyOrders(AuthenticatedUser actor) {
        return switch (actor.role()) {
            case DRIVER -> orderRepository.findByDriverIdOrderByCreatedAtDescIdDesc(actor.userId());
            case CUSTOMER -> orderRepository.findByCustomerIdOrderByCreatedAtDescIdDesc(actor.userId());
            case ADMIN -> List.of();
        };
    }

    /**
     * Audit history in timestamp order, for the customer, the assigned driver or an admin.
     */
    public List<OrderStatusLog> getOrderHistory(AuthenticatedUser actor, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        requireViewer(actor, order);
        return statusLogService.getHistory(orderId);
    }

    /**
     * Orders created in the last {@code days} days, newest first, optionally filtered by status.
     */
    public List<Order> getRecentOrders(int days, OrderStatus status) {
        if (days < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "days must be at least 1");
        }
        LocalDateTime since = now().minusDays(days);
        return status == null
                ? orderRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(since)
                : orderRepository.findByStatusAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(status, since);
    }

    private void recordTransition(Order order, OrderStatus previous, Long actorId, String notes) {
        statusLogService.append(order.getId(), previous, order.getStatus(), actorId, notes);
        eventPublisher.publishEvent(new OrderStatusChangedEvent(order.getId(), order.getOrderType(),
                order.getCustomerId(), order.getDriverId(), previous, order.getStatus(), actorId, now()));
    }

    private void requireEligible(Long driverId) {
        if (!walletService.canAcceptOrders(driverId)) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Wallet balance must cover the commission of "
                            + settingService.getDecimal(SettingKey.DEFAULT_COMMISSION) + " to take orders");
        }
    }

    private void requireViewer(AuthenticatedUser actor, Order order) {
        if (!actor.hasRole(UserRole.ADMIN) && !order.isOwnedBy(actor.userId())
                && !order.isAssignedTo(actor.userId())) {
            throw new BusinessException(ErrorCode.NOT_AUTHORIZED, "Not authorized to view this order");
        }
    }

    private String resolveAddress(String given, Coordinates point) {
        if (given != null && !given.isBlank()) {
            return given;
        }
        return mapsService.reverseGeocode(point).orElse(null);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    static String generateLocationToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        TOKEN_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
