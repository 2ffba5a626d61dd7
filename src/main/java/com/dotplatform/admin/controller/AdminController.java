package com.dotplatform.admin.controller;

import com.dotplatform.admin.dto.DriverStatsResponse;
import com.dotplatform.admin.dto.RefundRequest;
import com.dotplatform.admin.dto.TopUpRequest;
import com.dotplatform.admin.dto.UpdateSettingRequest;
import com.dotplatform.admin.service.AdminService;
import com.dotplatform.common.dto.ApiResponse;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.CurrentUser;
import com.dotplatform.common.security.UserRole;
import com.dotplatform.order.dto.OrderStatusLogResponse;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.service.OrderService;
import com.dotplatform.setting.service.PlatformSettingService;
import com.dotplatform.setting.service.SettingView;
import com.dotplatform.wallet.dto.TransactionResponse;
import com.dotplatform.wallet.dto.WalletResponse;
import com.dotplatform.wallet.service.WalletService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator endpoints. Every handler requires the ADMIN role.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final WalletService walletService;
    private final OrderService orderService;
    private final PlatformSettingService settingService;
    private final AdminService adminService;

    @PostMapping("/wallet/top-up")
    public ApiResponse<WalletResponse> topUp(@CurrentUser AuthenticatedUser admin,
                                             @Valid @RequestBody TopUpRequest request) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(WalletResponse.from(
                walletService.topUp(request.driverId(), request.amount(), admin.userId())));
    }

    @PostMapping("/wallet/refund")
    public ApiResponse<TransactionResponse> refundCommission(@CurrentUser AuthenticatedUser admin,
                                                             @Valid @RequestBody RefundRequest request) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(TransactionResponse.from(
                walletService.refundCommission(request.orderId(), admin.userId(), request.reason())));
    }

    @GetMapping("/orders/{id}/status-history")
    public ApiResponse<List<OrderStatusLogResponse>> getStatusHistory(@CurrentUser AuthenticatedUser admin,
                                                                      @PathVariable Long id) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(orderService.getOrderHistory(admin, id).stream()
                .map(OrderStatusLogResponse::from)
                .toList());
    }

    @GetMapping("/orders/logs")
    public ApiResponse<List<Order>> getOrderLogs(@CurrentUser AuthenticatedUser admin,
                                                 @RequestParam(defaultValue = "7") int days,
                                                 @RequestParam(required = false) OrderStatus status) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(orderService.getRecentOrders(days, status));
    }

    @GetMapping("/drivers/stats")
    public ApiResponse<List<DriverStatsResponse>> getDriverStats(@CurrentUser AuthenticatedUser admin) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(adminService.getDriverStats());
    }

    @GetMapping("/settings")
    public ApiResponse<List<SettingView>> getSettings(@CurrentUser AuthenticatedUser admin) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(settingService.getAll());
    }

    @PutMapping("/settings")
    public ApiResponse<SettingView> updateSetting(@CurrentUser AuthenticatedUser admin,
                                                  @Valid @RequestBody UpdateSettingRequest request) {
        admin.requireRole(UserRole.ADMIN);
        return ApiResponse.ok(settingService.update(request.key(), request.value()));
    }
}
