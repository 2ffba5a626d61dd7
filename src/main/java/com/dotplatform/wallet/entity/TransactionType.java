package com.dotplatform.wallet.entity;

public enum TransactionType {
    TOP_UP,       // admin credit
    DEDUCTION,    // commission for a completed order
    REFUND        // commission returned after a dispute
}
