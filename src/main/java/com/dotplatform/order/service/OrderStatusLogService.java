package com.dotplatform.order.service;

import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderStatusLog;
import com.dotplatform.order.repository.OrderStatusLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Audit trail of order status transitions.
 *
 * <ul>
 *   <li>Timestamps come from the server clock and never go backwards within one order: an entry
 *       is stamped no earlier than the previous entry of the same order.</li>
 *   <li>Each entry stores the hash of its predecessor plus its own SHA-256 hash.
 *       {@link #verifyChain(Long)} recomputes the chain to detect rewritten history.</li>
 *   <li>{@link #append} joins the caller's transaction; it runs while the order row is locked,
 *       so appends of one order never interleave.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderStatusLogService {

    private final OrderStatusLogRepository logRepository;
    private final Clock clock;

    @Transactional
    public OrderStatusLog append(Long orderId, OrderStatus oldStatus, OrderStatus newStatus,
                                 Long changedBy, String notes) {
        OrderStatusLog previous = logRepository.findFirstByOrderIdOrderByChangedAtDescIdDesc(orderId)
                .orElse(null);

        LocalDateTime changedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        if (previous != null && changedAt.isBefore(previous.getChangedAt())) {
            changedAt = previous.getChangedAt();
        }
        String previousHash = previous == null ? null : previous.getEntryHash();

        OrderStatusLog entry = logRepository.save(OrderStatusLog.builder()
                .orderId(orderId)
                .oldStatus(oldStatus)
                .newStatus(newStatus)
                .changedBy(changedBy)
                .changedAt(changedAt)
                .notes(notes)
                .previousHash(previousHash)
                .entryHash(hash(previousHash, orderId, oldStatus, newStatus, changedBy, changedAt, notes))
                .build());

        log.debug("Status log appended: orderId={}, {} -> {}, by={}", orderId, oldStatus, newStatus, changedBy);
        return entry;
    }

    public List<OrderStatusLog> getHistory(Long orderId) {
        return logRepository.findByOrderIdOrderByChangedAtAscIdAsc(orderId);
    }

    public boolean verifyChain(Long orderId) {
        String expectedPrevious = null;
        for (OrderStatusLog entry : getHistory(orderId)) {
            String recomputed = hash(entry.getPreviousHash(), entry.getOrderId(), entry.getOldStatus(),
                    entry.getNewStatus(), entry.getChangedBy(), entry.getChangedAt(), entry.getNotes());
            if (!Objects.equals(expectedPrevious, entry.getPreviousHash())
                    || !recomputed.equals(entry.getEntryHash())) {
                log.warn("Status log chain broken: orderId={}, entryId={}", orderId, entry.getId());
                return false;
            }
            expectedPrevious = entry.getEntryHash();
        }
        return true;
    }

    static String hash(String previousHash, Long orderId, OrderStatus oldStatus, OrderStatus newStatus,
                       Long changedBy, LocalDateTime changedAt, String notes) {
        String content = String.join("|",
                String.valueOf(previousHash),
                String.valueOf(orderId),
                String.valueOf(oldStatus),
                String.valueOf(newStatus),
                String.valueOf(changedBy),
                changedAt.truncatedTo(ChronoUnit.MILLIS).toString(),
                String.valueOf(notes));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
