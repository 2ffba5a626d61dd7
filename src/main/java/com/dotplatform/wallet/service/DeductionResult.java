package com.dotplatform.wallet.service;

import com.dotplatform.wallet.entity.WalletTransaction;

import java.math.BigDecimal;

/**
 * Outcome of a commission deduction. A decline is a normal result, not an error; the caller
 * decides whether it aborts the surrounding operation.
 */
public record DeductionResult(boolean approved, BigDecimal balance, WalletTransaction transaction) {

    public static DeductionResult approved(BigDecimal balance, WalletTransaction transaction) {
        return new DeductionResult(true, balance, transaction);
    }

    public static DeductionResult declined(BigDecimal balance) {
        return new DeductionResult(false, balance, null);
    }
}
