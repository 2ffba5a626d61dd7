package com.dotplatform.wallet.controller;

import com.dotplatform.common.dto.ApiResponse;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.CurrentUser;
import com.dotplatform.common.security.UserRole;
import com.dotplatform.realtime.service.RealtimeBroadcaster;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.service.PlatformSettingService;
import com.dotplatform.wallet.dto.DriverLocationRequest;
import com.dotplatform.wallet.dto.EligibilityResponse;
import com.dotplatform.wallet.dto.TransactionResponse;
import com.dotplatform.wallet.dto.WalletResponse;
import com.dotplatform.wallet.service.WalletService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/driver")
@RequiredArgsConstructor
public class DriverController {

    private final WalletService walletService;
    private final PlatformSettingService settingService;
    private final RealtimeBroadcaster broadcaster;

    @GetMapping("/wallet")
    public ApiResponse<WalletResponse> getWallet(@CurrentUser AuthenticatedUser user) {
        user.requireRole(UserRole.DRIVER);
        return ApiResponse.ok(WalletResponse.from(walletService.getOrCreateWallet(user.userId())));
    }

    @GetMapping("/transactions")
    public ApiResponse<List<TransactionResponse>> getTransactions(@CurrentUser AuthenticatedUser user,
                                                                  @RequestParam(required = false) Integer limit) {
        user.requireRole(UserRole.DRIVER);
        return ApiResponse.ok(walletService.getTransactions(user.userId(), limit).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    @GetMapping("/can-accept-orders")
    public ApiResponse<EligibilityResponse> canAcceptOrders(@CurrentUser AuthenticatedUser user) {
        user.requireRole(UserRole.DRIVER);
        return ApiResponse.ok(new EligibilityResponse(
                walletService.canAcceptOrders(user.userId()),
                walletService.getBalance(user.userId()),
                settingService.getDecimal(SettingKey.DEFAULT_COMMISSION)));
    }

    /**
     * HTTP alternative to the {@code driver_location} WebSocket message.
     */
    @PostMapping("/location")
    public ApiResponse<Void> updateLocation(@CurrentUser AuthenticatedUser user,
                                            @Valid @RequestBody DriverLocationRequest request) {
        user.requireRole(UserRole.DRIVER);
        broadcaster.updateDriverLocation(user.userId(), request.latitude(), request.longitude());
        return ApiResponse.ok(null);
    }
}
