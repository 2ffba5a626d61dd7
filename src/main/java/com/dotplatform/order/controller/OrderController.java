package com.dotplatform.order.controller;

import com.dotplatform.common.dto.ApiResponse;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.CurrentUser;
import com.dotplatform.order.dto.CancelOrderRequest;
import com.dotplatform.order.dto.CreateDeliveryOrderRequest;
import com.dotplatform.order.dto.CreateTaxiOrderRequest;
import com.dotplatform.order.dto.OrderStatusLogResponse;
import com.dotplatform.order.dto.UpdateOrderStatusRequest;
import com.dotplatform.order.entity.Order;
import com.dotplatform.order.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping("/taxi")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Order> createTaxiOrder(@CurrentUser AuthenticatedUser user,
                                              @Valid @RequestBody CreateTaxiOrderRequest request) {
        return ApiResponse.ok(orderService.createTaxiOrder(user, request));
    }

    @PostMapping("/delivery")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Order> createDeliveryOrder(@CurrentUser AuthenticatedUser user,
                                                  @Valid @RequestBody CreateDeliveryOrderRequest request) {
        return ApiResponse.ok(orderService.createDeliveryOrder(user, request));
    }

    @GetMapping("/pending")
    public ApiResponse<List<Order>> getPendingOrders(@CurrentUser AuthenticatedUser user) {
        return ApiResponse.ok(orderService.getPendingOrders(user));
    }

    @GetMapping("/my")
    public ApiResponse<List<Order>> getMyOrders(@CurrentUser AuthenticatedUser user) {
        return ApiResponse.ok(orderService.getMyOrders(user));
    }

    @GetMapping("/{id}")
    public ApiResponse<Order> getOrder(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrder(user, id));
    }

    @GetMapping("/{id}/history")
    public ApiResponse<List<OrderStatusLogResponse>> getOrderHistory(@CurrentUser AuthenticatedUser user,
                                                                     @PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrderHistory(user, id).stream()
                .map(OrderStatusLogResponse::from)
                .toList());
    }

    @PostMapping("/{id}/accept")
    public ApiResponse<Order> acceptOrder(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ApiResponse.ok(orderService.acceptOrder(user, id));
    }

    @PostMapping("/{id}/status")
    public ApiResponse<Order> updateOrderStatus(@CurrentUser AuthenticatedUser user,
                                                @PathVariable Long id,
                                                @Valid @RequestBody UpdateOrderStatusRequest request) {
        return ApiResponse.ok(orderService.updateOrderStatus(user, id, request));
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse<Order> cancelOrder(@CurrentUser AuthenticatedUser user,
                                          @PathVariable Long id,
                                          @Valid @RequestBody(required = false) CancelOrderRequest request) {
        return ApiResponse.ok(orderService.cancelOrder(user, id, request == null ? null : request.reason()));
    }
}
