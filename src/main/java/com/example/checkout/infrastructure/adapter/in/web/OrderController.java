package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.OrderSummary;
import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.CancelOrderUseCase;
import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.OrderId;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the caller's own orders.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "訂單查詢與取消 API")
public class OrderController {

    private static final int MAX_PAGE_SIZE = 100;

    private final OrderQueryUseCase orderQueryUseCase;
    private final CancelOrderUseCase cancelOrderUseCase;

    public OrderController(OrderQueryUseCase orderQueryUseCase, CancelOrderUseCase cancelOrderUseCase) {
        this.orderQueryUseCase = orderQueryUseCase;
        this.cancelOrderUseCase = cancelOrderUseCase;
    }

    @Operation(summary = "查詢我的訂單", description = "依建立時間由新到舊排序")
    @GetMapping
    public Mono<List<OrderSummary>> listOrders(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam(defaultValue = "20") int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return Mono.fromCallable(() -> orderQueryUseCase.recentOrders(userId, boundedLimit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "查詢訂單明細", description = "包含品項、狀態歷程與事件")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "查詢成功"),
            @ApiResponse(responseCode = "404", description = "訂單不存在")
    })
    @GetMapping("/{orderId}")
    public Mono<OrderView> getOrder(
            @RequestHeader("X-User-Id") UUID userId,
            @Parameter(description = "訂單 ID", required = true)
            @PathVariable String orderId) {
        return Mono.fromCallable(() -> orderQueryUseCase.findOwnedOrder(OrderId.of(orderId), userId)
                        .orElseThrow(() -> new OrderNotFoundException(orderId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(
            summary = "取消訂單",
            description = "僅 pending、processing、confirmed 狀態可取消；已扣減的庫存將回補"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "取消成功"),
            @ApiResponse(responseCode = "404", description = "訂單不存在"),
            @ApiResponse(responseCode = "409", description = "訂單狀態不允許取消")
    })
    @PostMapping("/{orderId}/cancel")
    public Mono<OrderView> cancelOrder(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable String orderId) {
        return Mono.fromCallable(() -> cancelOrderUseCase.cancel(OrderId.of(orderId), Actor.user(userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
