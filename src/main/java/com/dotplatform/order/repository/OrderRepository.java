package com.dotplatform.order.repository;

import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * SELECT ... FOR UPDATE on the order row. Every status change reads the current status
     * through this lock, so two accepts racing for one PENDING order are serialized: the second
     * one sees ACCEPTED and fails.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdWithLock(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.recipientLocationToken = :token")
    Optional<Order> findByRecipientLocationTokenWithLock(@Param("token") String token);

    List<Order> findByStatusOrderByCreatedAtDescIdDesc(OrderStatus status);

    List<Order> findByCustomerIdOrderByCreatedAtDescIdDesc(Long customerId);

    List<Order> findByDriverIdOrderByCreatedAtDescIdDesc(Long driverId);

    List<Order> findByCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(LocalDateTime since);

    List<Order> findByStatusAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
            OrderStatus status, LocalDateTime since);

    long countByDriverId(Long driverId);

    long countByDriverIdAndStatus(Long driverId, OrderStatus status);
}
