package com.dotplatform.wallet.dto;

import com.dotplatform.wallet.entity.TransactionType;
import com.dotplatform.wallet.entity.WalletTransaction;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record TransactionResponse(
        Long id,
        TransactionType type,
        BigDecimal amount,
        String description,
        Long orderId,
        Long adminId,
        LocalDateTime createdAt
) {
    public static TransactionResponse from(WalletTransaction transaction) {
        return new TransactionResponse(transaction.getId(), transaction.getType(), transaction.getAmount(),
                transaction.getDescription(), transaction.getOrderId(), transaction.getAdminId(),
                transaction.getCreatedAt());
    }
}
