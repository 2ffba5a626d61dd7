package com.dotplatform.wallet.dto;

import com.dotplatform.wallet.entity.Wallet;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record WalletResponse(Long driverId, BigDecimal balance, LocalDateTime updatedAt) {

    public static WalletResponse from(Wallet wallet) {
        return new WalletResponse(wallet.getDriverId(), wallet.getBalance(), wallet.getUpdatedAt());
    }
}
