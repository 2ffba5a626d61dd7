package com.dotplatform.order.repository;

import com.dotplatform.order.entity.OrderStatusLog;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only: only insert and read operations are exposed.
 */
public interface OrderStatusLogRepository extends Repository<OrderStatusLog, Long> {

    OrderStatusLog save(OrderStatusLog log);

    List<OrderStatusLog> findByOrderIdOrderByChangedAtAscIdAsc(Long orderId);

    Optional<OrderStatusLog> findFirstByOrderIdOrderByChangedAtDescIdDesc(Long orderId);
}
