package com.dotplatform.admin.service;

import com.dotplatform.admin.dto.DriverStatsResponse;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.repository.OrderRepository;
import com.dotplatform.rating.service.RatingService;
import com.dotplatform.wallet.entity.Wallet;
import com.dotplatform.wallet.service.WalletService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Reporting for the operator dashboard. Drivers are known to the platform through their wallet.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AdminService {

    private final WalletService walletService;
    private final OrderRepository orderRepository;
    private final RatingService ratingService;

    public List<DriverStatsResponse> getDriverStats() {
        return walletService.getAllWallets().stream()
                .map(this::toStats)
                .toList();
    }

    private DriverStatsResponse toStats(Wallet wallet) {
        Long driverId = wallet.getDriverId();
        return new DriverStatsResponse(
                driverId,
                orderRepository.countByDriverId(driverId),
                orderRepository.countByDriverIdAndStatus(driverId, OrderStatus.COMPLETED),
                orderRepository.countByDriverIdAndStatus(driverId, OrderStatus.CANCELLED),
                ratingService.getAverageScore(driverId),
                wallet.getBalance());
    }
}
