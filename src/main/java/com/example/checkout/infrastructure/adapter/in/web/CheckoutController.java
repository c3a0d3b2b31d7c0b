package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.CheckoutReceipt;
import com.example.checkout.application.port.in.SubmitCheckoutUseCase;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.SubmitCheckoutRequest;
import com.example.checkout.infrastructure.adapter.in.web.mapper.CheckoutWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * REST controller for checkout submission.
 * Supports idempotency via X-Idempotency-Key header.
 */
@RestController
@RequestMapping("/api/checkout")
@Tag(name = "Checkout", description = "結帳 API")
public class CheckoutController {

    private static final Logger log = LoggerFactory.getLogger(CheckoutController.class);

    // matches checkout_attempts.idempotency_key
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 64;

    private final SubmitCheckoutUseCase submitCheckoutUseCase;
    private final CheckoutWebMapper mapper;

    public CheckoutController(SubmitCheckoutUseCase submitCheckoutUseCase, CheckoutWebMapper mapper) {
        this.submitCheckoutUseCase = submitCheckoutUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "提交結帳",
            description = """
                    將使用者購物車送入結帳流程，立即返回 checkoutId：
                    1. **validate_inventory** - 驗證商品可購買且庫存足夠
                    2. **create_order** - 建立訂單（以 checkoutId 冪等）
                    3. **deduct_stock** - 於資料列鎖下扣減庫存
                    4. **send_confirmation** - 寄送確認並清空購物車

                    進度可透過 `GET /api/checkout/{checkoutId}` 或 `/ws/user-orders/{userId}` 追蹤。

                    **冪等性支援**：相同 X-Idempotency-Key 的重複請求返回原結帳紀錄。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "202",
                    description = "結帳已受理",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "checkoutId": "550e8400-e29b-41d4-a716-446655440000",
                                      "status": "accepted",
                                      "createdAt": "2026-02-02T12:00:00Z",
                                      "updatedAt": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "200", description = "冪等請求 - 返回先前結帳紀錄"),
            @ApiResponse(responseCode = "400", description = "請求參數錯誤"),
            @ApiResponse(
                    responseCode = "422",
                    description = "購物車不存在、為空或結帳進行中",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "CHECKOUT_REJECTED",
                                      "message": "Cart is empty",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            )
    })
    @PostMapping
    public Mono<ResponseEntity<CheckoutResponse>> submit(
            @Parameter(description = "由 API Gateway 轉送的使用者 ID", required = true)
            @RequestHeader("X-User-Id") UUID userId,
            @Parameter(description = "冪等鍵 - 用於確保請求安全重試。若不提供，系統將自動生成。")
            @RequestHeader(value = "X-Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody SubmitCheckoutRequest request) {

        final String effectiveIdempotencyKey = (idempotencyKey != null && !idempotencyKey.isBlank())
                ? idempotencyKey
                : UUID.randomUUID().toString();
        if (effectiveIdempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "X-Idempotency-Key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }

        log.info("Received checkout request from user {}, idempotencyKey: {}", userId, effectiveIdempotencyKey);

        return Mono.fromCallable(() -> submitCheckoutUseCase.submit(
                        mapper.toCommand(userId, effectiveIdempotencyKey, request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toResponseEntity);
    }

    @Operation(summary = "查詢結帳狀態", description = "僅限結帳擁有者查詢")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "查詢成功"),
            @ApiResponse(responseCode = "404", description = "結帳紀錄不存在")
    })
    @GetMapping("/{checkoutId}")
    public Mono<CheckoutResponse> status(
            @RequestHeader("X-User-Id") UUID userId,
            @Parameter(description = "結帳 ID", required = true)
            @PathVariable UUID checkoutId) {
        return Mono.fromCallable(() -> submitCheckoutUseCase.status(checkoutId, userId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(mapper::toResponse);
    }

    private ResponseEntity<CheckoutResponse> toResponseEntity(CheckoutReceipt receipt) {
        if (receipt.duplicate()) {
            log.info("Returning existing checkout {} for repeated idempotency key", receipt.checkoutId());
            return ResponseEntity.ok(mapper.toResponse(receipt));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(mapper.toResponse(receipt));
    }
}
