package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.OrderFulfilmentUseCase;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.PaymentStatus;
import com.example.checkout.infrastructure.adapter.in.web.dto.PaymentStatusRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.ShipOrderRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Back-office order transitions. Access control is enforced by the gateway.
 */
@RestController
@RequestMapping("/api/admin/orders/{orderId}")
@Tag(name = "Admin Orders", description = "後台訂單出貨與付款狀態 API")
@ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "更新成功"),
        @ApiResponse(responseCode = "404", description = "訂單不存在"),
        @ApiResponse(responseCode = "409", description = "狀態轉換不合法")
})
public class AdminOrderController {

    private final OrderFulfilmentUseCase fulfilmentUseCase;

    public AdminOrderController(OrderFulfilmentUseCase fulfilmentUseCase) {
        this.fulfilmentUseCase = fulfilmentUseCase;
    }

    @Operation(summary = "出貨", description = "confirmed → shipped，記錄物流單號")
    @PostMapping("/ship")
    public Mono<OrderView> ship(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable String orderId,
            @Valid @RequestBody ShipOrderRequest request) {
        return Mono.fromCallable(() -> fulfilmentUseCase.ship(
                        OrderId.of(orderId), request.trackingNumber(), Actor.user(adminId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "送達", description = "shipped → delivered")
    @PostMapping("/deliver")
    public Mono<OrderView> deliver(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable String orderId) {
        return Mono.fromCallable(() -> fulfilmentUseCase.deliver(OrderId.of(orderId), Actor.user(adminId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "更新付款狀態", description = "依付款狀態機轉換，例如 pending → paid")
    @PutMapping("/payment-status")
    public Mono<OrderView> updatePaymentStatus(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable String orderId,
            @Valid @RequestBody PaymentStatusRequest request) {
        return Mono.fromCallable(() -> fulfilmentUseCase.updatePaymentStatus(
                        OrderId.of(orderId),
                        PaymentStatus.fromWireValue(request.paymentStatus()),
                        Actor.user(adminId)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
