package com.dotplatform.wallet.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.service.PlatformSettingService;
import com.dotplatform.wallet.entity.TransactionType;
import com.dotplatform.wallet.entity.Wallet;
import com.dotplatform.wallet.entity.WalletTransaction;
import com.dotplatform.wallet.repository.WalletRepository;
import com.dotplatform.wallet.repository.WalletTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Driver wallet ledger.
 *
 * <h3>Consistency</h3>
 * <ul>
 *   <li>Every balance change is paired with exactly one appended {@link WalletTransaction}
 *       in the same transaction.</li>
 *   <li>Mutations lock the wallet row first ({@code SELECT ... FOR UPDATE}); the balance check
 *       and the debit that follows run under that lock, so two deductions can never both pass
 *       against a balance that only covers one.</li>
 *   <li>{@link #deductCommission} joins the caller's transaction. When the order completion
 *       aborts, the debit and its transaction row roll back with it.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WalletService {

    public static final int DEFAULT_TRANSACTION_LIMIT = 50;
    public static final int MAX_TRANSACTION_LIMIT = 200;

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository transactionRepository;
    private final PlatformSettingService settingService;

    /**
     * Idempotent: returns the existing wallet or creates one with a zero balance.
     */
    @Transactional
    public Wallet getOrCreateWallet(Long driverId) {
        return walletRepository.findByDriverId(driverId)
                .orElseGet(() -> createWallet(driverId));
    }

    @Transactional
    public Wallet topUp(Long driverId, BigDecimal topUpAmount, Long adminId) {
        BigDecimal amount = requirePositiveAmount(topUpAmount);

        Wallet wallet = lockWallet(driverId);
        wallet.credit(amount);
        transactionRepository.save(WalletTransaction.builder()
                .wallet(wallet)
                .type(TransactionType.TOP_UP)
                .amount(amount)
                .description("Wallet top-up by admin #" + adminId)
                .adminId(adminId)
                .build());

        log.info("Wallet top-up: driverId={}, amount={}, adminId={}, balance={}",
                driverId, amount, adminId, wallet.getBalance());
        return wallet;
    }

    /**
     * Debits the commission for a completed order. Returns a declined result, without touching
     * the wallet, when the balance does not cover the amount.
     */
    @Transactional
    public DeductionResult deductCommission(Long driverId, BigDecimal commission, Long orderId) {
        BigDecimal amount = requirePositiveAmount(commission);

        Wallet wallet = lockWallet(driverId);
        if (!wallet.hasAtLeast(amount)) {
            log.warn("Commission declined: driverId={}, orderId={}, amount={}, balance={}",
                    driverId, orderId, amount, wallet.getBalance());
            return DeductionResult.declined(wallet.getBalance());
        }

        wallet.debit(amount);
        WalletTransaction transaction = transactionRepository.save(WalletTransaction.builder()
                .wallet(wallet)
                .type(TransactionType.DEDUCTION)
                .amount(amount)
                .description("Commission for order #" + orderId)
                .orderId(orderId)
                .build());

        log.info("Commission deducted: driverId={}, orderId={}, amount={}, balance={}",
                driverId, orderId, amount, wallet.getBalance());
        return DeductionResult.approved(wallet.getBalance(), transaction);
    }

    /**
     * Returns the commission taken for an order to the driver. At most one refund per order.
     * The refund check runs under the wallet lock, so of two concurrent refunds the second one
     * sees the first and fails with ALREADY_REFUNDED.
     */
    @Transactional
    public WalletTransaction refundCommission(Long orderId, Long adminId, String reason) {
        WalletTransaction deduction = transactionRepository
                .findFirstByOrderIdAndType(orderId, TransactionType.DEDUCTION)
                .orElseThrow(() -> new BusinessException(ErrorCode.DEDUCTION_NOT_FOUND));

        // by id: the lazy wallet reference stays uninitialized until the locked read
        Wallet wallet = walletRepository.findByIdWithLock(deduction.getWallet().getId()).orElseThrow();
        if (transactionRepository.existsByOrderIdAndType(orderId, TransactionType.REFUND)) {
            throw new BusinessException(ErrorCode.ALREADY_REFUNDED);
        }

        Long driverId = wallet.getDriverId();
        wallet.credit(deduction.getAmount());

        String description = "Commission refund for order #" + orderId
                + (reason == null || reason.isBlank() ? "" : ": " + reason);
        WalletTransaction refund = transactionRepository.save(WalletTransaction.builder()
                .wallet(wallet)
                .type(TransactionType.REFUND)
                .amount(deduction.getAmount())
                .description(description)
                .orderId(orderId)
                .adminId(adminId)
                .build());

        log.info("Commission refunded: driverId={}, orderId={}, amount={}, adminId={}",
                driverId, orderId, deduction.getAmount(), adminId);
        return refund;
    }

    /**
     * A driver may see and accept orders only while the balance covers the current default
     * commission.
     */
    public boolean canAcceptOrders(Long driverId) {
        BigDecimal commission = settingService.getDecimal(SettingKey.DEFAULT_COMMISSION);
        return getBalance(driverId).compareTo(commission) >= 0;
    }

    public BigDecimal getBalance(Long driverId) {
        return walletRepository.findByDriverId(driverId)
                .map(Wallet::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Newest first. {@code limit} is clamped to 1..{@value #MAX_TRANSACTION_LIMIT}; null means
     * {@value #DEFAULT_TRANSACTION_LIMIT}.
     */
    public List<WalletTransaction> getTransactions(Long driverId, Integer limit) {
        int size = limit == null ? DEFAULT_TRANSACTION_LIMIT : Math.max(1, Math.min(limit, MAX_TRANSACTION_LIMIT));
        return walletRepository.findByDriverId(driverId)
                .map(wallet -> transactionRepository.findByWalletIdOrderByCreatedAtDescIdDesc(
                        wallet.getId(), PageRequest.of(0, size)))
                .orElse(List.of());
    }

    public List<Wallet> getAllWallets() {
        return walletRepository.findAllByOrderByDriverIdAsc();
    }

    private Wallet lockWallet(Long driverId) {
        return walletRepository.findByDriverIdWithLock(driverId)
                .orElseGet(() -> createWallet(driverId));
    }

    private Wallet createWallet(Long driverId) {
        log.info("Creating wallet: driverId={}", driverId);
        return walletRepository.saveAndFlush(Wallet.builder().driverId(driverId).build());
    }

    private BigDecimal requirePositiveAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > Wallet.MONEY_SCALE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount must have at most 2 decimals");
        }
        return amount.setScale(Wallet.MONEY_SCALE, RoundingMode.UNNECESSARY);
    }
}
